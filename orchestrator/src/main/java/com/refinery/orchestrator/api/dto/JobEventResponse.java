package com.refinery.orchestrator.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.refinery.orchestrator.model.JobEvent;

import java.time.Instant;
import java.util.UUID;

/**
 * One entry of a job's event log, as polled, streamed over SSE or sent in a
 * WebSocket "event" frame.
 */
public record JobEventResponse(
        UUID     jobId,
        long     sequence,
        String   eventType,
        Integer  passNumber,
        String   message,
        JsonNode details,
        Instant  createdAt
) {
    public static JobEventResponse from(JobEvent e) {
        return new JobEventResponse(
                e.getJobId(),
                e.getSequence(),
                e.getEventType().wireName(),
                e.getPassNumber(),
                e.getMessage(),
                e.getDetails(),
                e.getCreatedAt()
        );
    }
}
