package com.openlearn.collector.exception;

/**
 * 네트워크 오류, 5xx, 타임아웃 등 재시도로 회복 가능한 예외
 */
public class TransientSourceException extends CollectionException {

    public TransientSourceException(String message, String sourceKey) {
        super("TRANSIENT_ERROR", message, sourceKey);
    }

    public TransientSourceException(String message, String sourceKey, Throwable cause) {
        super("TRANSIENT_ERROR", message, sourceKey, cause);
    }

    /**
     * 수집 요청 타임아웃
     */
    public static TransientSourceException timeout(String sourceKey, long timeoutMillis) {
        return new TransientSourceException(
                "Fetch timed out after " + timeoutMillis + "ms", sourceKey);
    }

    /**
     * 원격 서버 오류 (5xx)
     */
    public static TransientSourceException serverError(String sourceKey, int status, Throwable cause) {
        return new TransientSourceException("Upstream returned HTTP " + status, sourceKey, cause);
    }
}
