package com.openlearn.collector.service.collection;

import com.openlearn.collector.exception.CapacityExceededException;
import com.openlearn.collector.exception.CollectionFailedException;
import com.openlearn.collector.exception.FailureKind;
import com.openlearn.collector.exception.ItemValidationException;
import com.openlearn.collector.exception.JobStoreUnavailableException;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;

import java.time.Duration;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;

/**
 * 수집 오류 분류. 스케줄러는 분류 결과({@link FailureKind})만 보고 재시도/dead-letter/재큐잉을 결정합니다.
 */
@Component
public class FailureClassifier {

    public FailureKind classify(Throwable error) {
        Throwable t = unwrap(error);
        if (t instanceof CollectionFailedException failed) {
            return failed.getKind();
        }
        if (t instanceof CapacityExceededException
                || t instanceof RejectedExecutionException
                || t instanceof TaskRejectedException) {
            return FailureKind.CAPACITY;
        }
        if (t instanceof ItemValidationException) {
            return FailureKind.VALIDATION;
        }
        if (isStoreUnavailable(t)) {
            return FailureKind.FATAL;
        }
        return FailureKind.TRANSIENT;
    }

    public CollectionFailedException toFailure(String sourceKey, Throwable error) {
        Throwable t = unwrap(error);
        if (t instanceof CollectionFailedException failed) {
            return failed;
        }
        FailureKind kind = classify(t);
        Duration retryAfter = t instanceof CapacityExceededException capacity ? capacity.getRetryAfter() : null;
        String message = t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
        return new CollectionFailedException(kind, message, sourceKey, retryAfter, t);
    }

    /**
     * 작업 저장소 연결 실패 여부 (원인 체인 포함)
     */
    public boolean isStoreUnavailable(Throwable error) {
        Throwable t = error;
        while (t != null) {
            if (t instanceof JobStoreUnavailableException
                    || t instanceof DataAccessResourceFailureException
                    || t instanceof CannotCreateTransactionException) {
                return true;
            }
            t = t.getCause() == t ? null : t.getCause();
        }
        return false;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while ((t instanceof ExecutionException || t instanceof CompletionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
