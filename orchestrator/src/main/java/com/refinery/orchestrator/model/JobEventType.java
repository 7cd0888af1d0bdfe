package com.refinery.orchestrator.model;

/**
 * Kinds of facts recorded in a job's event log.
 *
 * RESYNC_REQUIRED is never persisted: it is a sentinel that a live
 * subscription emits after its buffer overflowed, telling the observer
 * to re-attach with the last sequence it saw.
 */
public enum JobEventType {
    JOB_STARTED,
    PASS_STARTED,
    PASS_COMPLETED,
    PASS_FAILED,
    JOB_COMPLETED,
    JOB_FAILED,
    JOB_CANCELLED,
    RESYNC_REQUIRED;

    /** True for the last event a job will ever append. */
    public boolean isTerminal() {
        return this == JOB_COMPLETED || this == JOB_FAILED || this == JOB_CANCELLED;
    }

    /** Wire name, e.g. "pass_completed". */
    public String wireName() {
        return name().toLowerCase();
    }
}
