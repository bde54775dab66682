package com.openlearn.collector.exception;

/**
 * 같은 소스의 수집이 이미 실행 중일 때 수동 트리거를 거절합니다.
 */
public class JobAlreadyRunningException extends CollectionException {

    public JobAlreadyRunningException(String sourceKey) {
        super("JOB_ALREADY_RUNNING", "A collection run is already in flight for source " + sourceKey, sourceKey);
    }
}
