package com.openlearn.collector.exception;

/**
 * 작업 저장소에 접근할 수 없을 때. 중복 트리거를 막을 수 없으므로 스케줄링을 중단합니다.
 */
public class JobStoreUnavailableException extends CollectionException {

    public JobStoreUnavailableException(String message, Throwable cause) {
        super("JOB_STORE_UNAVAILABLE", message, null, cause);
    }

    public JobStoreUnavailableException(String message, String sourceKey, Throwable cause) {
        super("JOB_STORE_UNAVAILABLE", message, sourceKey, cause);
    }
}
