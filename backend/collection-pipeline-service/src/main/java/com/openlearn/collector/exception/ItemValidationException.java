package com.openlearn.collector.exception;

/**
 * 잘못된 형식의 응답/항목. 같은 입력이면 같은 결과가 나오므로 재시도하지 않습니다.
 */
public class ItemValidationException extends CollectionException {

    public ItemValidationException(String message, String sourceKey) {
        super("VALIDATION_ERROR", message, sourceKey);
    }

    public ItemValidationException(String message, String sourceKey, Throwable cause) {
        super("VALIDATION_ERROR", message, sourceKey, cause);
    }

    /**
     * 응답 파싱 실패
     */
    public static ItemValidationException unparseable(String sourceKey, Throwable cause) {
        return new ItemValidationException("Unable to parse upstream response: " + cause.getMessage(),
                sourceKey, cause);
    }
}
