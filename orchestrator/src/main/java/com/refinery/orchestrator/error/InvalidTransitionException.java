package com.refinery.orchestrator.error;

import com.refinery.orchestrator.model.JobStatus;

import java.util.Map;
import java.util.UUID;

/**
 * A state-machine transition that is not legal from the job's current status.
 * Never applied; the job is left exactly as it was.
 */
public class InvalidTransitionException extends RefineryException {

    public InvalidTransitionException(UUID jobId, JobStatus from, String transition) {
        super(ErrorCode.INVALID_TRANSITION,
                "Transition " + transition + " is not allowed for job " + jobId + " in status " + from,
                Map.of("jobId", String.valueOf(jobId), "status", from.wireName(), "transition", transition));
    }

    public InvalidTransitionException(UUID jobId, JobStatus from, String transition, String reason) {
        super(ErrorCode.INVALID_TRANSITION,
                "Transition " + transition + " is not allowed for job " + jobId + ": " + reason,
                Map.of("jobId", String.valueOf(jobId), "status", from.wireName(), "transition", transition));
    }
}
