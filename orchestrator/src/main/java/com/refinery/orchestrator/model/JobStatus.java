package com.refinery.orchestrator.model;

import com.refinery.orchestrator.error.ValidationException;

/**
 * Lifecycle of a refinement Job.
 *
 * Transitions:
 *   PENDING    → PROCESSING (worker claims the job)
 *   PROCESSING → COMPLETED  (last pass succeeded)
 *   PROCESSING → FAILED     (retries exhausted or fatal pass error)
 *   PENDING | PROCESSING → CANCELLED
 *
 * Nothing leaves a terminal state and nothing re-enters PENDING.
 */
public enum JobStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /** Wire name, e.g. "processing". */
    public String wireName() {
        return name().toLowerCase();
    }

    /**
     * Parse a status as sent by clients; case-insensitive.
     *
     * @throws ValidationException if the value names no status
     */
    public static JobStatus fromWire(String value) {
        for (JobStatus status : values()) {
            if (status.name().equalsIgnoreCase(value)) return status;
        }
        throw new ValidationException("status", "Unknown job status: " + value);
    }
}
