package com.refinery.orchestrator.stream;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.refinery.orchestrator.api.dto.JobEventResponse;
import com.refinery.orchestrator.model.JobEvent;
import com.refinery.orchestrator.model.JobEventType;

import java.time.Instant;
import java.util.UUID;

/**
 * JSON frame sent to WebSocket progress observers.
 *
 *   connected        first frame after the handshake
 *   event            one job event
 *   heartbeat        sent while no event arrived for heartbeat-interval
 *   resync_required  live feed dropped; reconnect with since = event.sequence
 *   end              the job reached a terminal state; the server closes next
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProgressFrame(String type, UUID jobId, JobEventResponse event, String message, Instant ts) {

    public static ProgressFrame connected(UUID jobId, long since, Instant now) {
        return new ProgressFrame("connected", jobId, null,
                "Streaming events after sequence " + since, now);
    }

    public static ProgressFrame event(JobEvent event, Instant now) {
        String type = event.getEventType() == JobEventType.RESYNC_REQUIRED ? "resync_required" : "event";
        return new ProgressFrame(type, event.getJobId(), JobEventResponse.from(event), null, now);
    }

    public static ProgressFrame heartbeat(UUID jobId, Instant now) {
        return new ProgressFrame("heartbeat", jobId, null, null, now);
    }

    public static ProgressFrame end(UUID jobId, Instant now) {
        return new ProgressFrame("end", jobId, null, "Stream closed", now);
    }
}
