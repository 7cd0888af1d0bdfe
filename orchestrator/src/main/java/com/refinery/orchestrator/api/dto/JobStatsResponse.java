package com.refinery.orchestrator.api.dto;

import com.refinery.orchestrator.model.JobStatus;

import java.util.LinkedHashMap;
import java.util.Map;

/** Response body for GET /jobs/stats. */
public record JobStatsResponse(long total, Map<String, Long> byStatus) {

    public static JobStatsResponse from(Map<JobStatus, Long> counts) {
        Map<String, Long> byStatus = new LinkedHashMap<>();
        long total = 0;
        for (JobStatus status : JobStatus.values()) {
            long count = counts.getOrDefault(status, 0L);
            byStatus.put(status.wireName(), count);
            total += count;
        }
        return new JobStatsResponse(total, byStatus);
    }
}
