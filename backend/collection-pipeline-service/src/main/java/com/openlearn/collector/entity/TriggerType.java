package com.openlearn.collector.entity;

/**
 * What created a collection job row.
 */
public enum TriggerType {
    PERIODIC,
    MANUAL,
    RETRY,
    REQUEUE,
    RECOVERY
}
