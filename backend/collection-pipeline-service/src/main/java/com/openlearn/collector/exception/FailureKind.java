package com.openlearn.collector.exception;

/**
 * Classification the scheduler acts on.
 */
public enum FailureKind {
    TRANSIENT,
    VALIDATION,
    CAPACITY,
    FATAL
}
