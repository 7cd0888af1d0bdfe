package com.refinery.orchestrator.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.refinery.orchestrator.model.Job;

import java.time.Instant;
import java.util.UUID;

/**
 * Job snapshot returned by every /jobs endpoint.
 *
 * progress is currentPass / totalPasses as a percentage, rounded down.
 */
public record JobResponse(
        UUID     id,
        String   fileId,
        String   fileName,
        String   userId,
        String   status,
        int      currentPass,
        int      totalPasses,
        int      progress,
        String   model,
        Instant  createdAt,
        Instant  updatedAt,
        Instant  completedAt,
        String   errorMessage,
        JsonNode result,
        JsonNode metadata
) {
    public static JobResponse from(Job job) {
        return new JobResponse(
                job.getId(),
                job.getFileId(),
                job.getFileName(),
                job.getUserId(),
                job.getStatus().wireName(),
                job.getCurrentPass(),
                job.getTotalPasses(),
                job.getCurrentPass() * 100 / job.getTotalPasses(),
                job.getModel(),
                job.getCreatedAt(),
                job.getUpdatedAt(),
                job.getCompletedAt(),
                job.getErrorMessage(),
                job.getResult(),
                job.getMetadata()
        );
    }
}
