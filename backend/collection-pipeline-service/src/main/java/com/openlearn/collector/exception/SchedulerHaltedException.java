package com.openlearn.collector.exception;

public class SchedulerHaltedException extends CollectionException {

    public SchedulerHaltedException(String reason) {
        super("SCHEDULER_HALTED", "Scheduling is halted: " + reason);
    }
}
