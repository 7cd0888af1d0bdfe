package com.refinery.orchestrator.store;

import com.refinery.orchestrator.model.JobStatus;

import java.time.Instant;

/**
 * Optional criteria for listing jobs. Null fields do not filter.
 * Results are always newest first.
 */
public record JobFilter(JobStatus status, String userId,
                        Instant createdAfter, Instant createdBefore, Integer limit) {

    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT     = 500;

    public static JobFilter all() {
        return new JobFilter(null, null, null, null, null);
    }

    public int effectiveLimit() {
        if (limit == null || limit < 1) return DEFAULT_LIMIT;
        return Math.min(limit, MAX_LIMIT);
    }
}
