package com.openlearn.collector.exception;

/**
 * 수집 파이프라인 예외 기본 클래스
 */
public class CollectionException extends RuntimeException {

    private final String errorCode;
    private final String sourceKey;

    public CollectionException(String message) {
        super(message);
        this.errorCode = "COLLECTION_ERROR";
        this.sourceKey = null;
    }

    public CollectionException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
        this.sourceKey = null;
    }

    public CollectionException(String errorCode, String message, String sourceKey) {
        super(message);
        this.errorCode = errorCode;
        this.sourceKey = sourceKey;
    }

    public CollectionException(String errorCode, String message, String sourceKey, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.sourceKey = sourceKey;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getSourceKey() {
        return sourceKey;
    }
}
