package com.refinery.orchestrator.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One state-machine step applied to a Job.
 *
 *   START           PENDING    → PROCESSING
 *   PASS_SUCCEEDED  PROCESSING → PROCESSING   (current_pass += 1, more passes remain)
 *   COMPLETE        PROCESSING → COMPLETED    (last pass succeeded; sets result)
 *   FAIL            PROCESSING → FAILED       (sets error_message)
 *   CANCEL          PENDING | PROCESSING → CANCELLED
 */
public record JobTransition(Kind kind, JsonNode result, String errorMessage) {

    public enum Kind { START, PASS_SUCCEEDED, COMPLETE, FAIL, CANCEL }

    public static JobTransition start()                    { return new JobTransition(Kind.START, null, null); }
    public static JobTransition passSucceeded()            { return new JobTransition(Kind.PASS_SUCCEEDED, null, null); }
    public static JobTransition complete(JsonNode result)  { return new JobTransition(Kind.COMPLETE, result, null); }
    public static JobTransition fail(String errorMessage)  { return new JobTransition(Kind.FAIL, null, errorMessage); }
    public static JobTransition cancel()                   { return new JobTransition(Kind.CANCEL, null, null); }

    public JobStatus target() {
        return switch (kind) {
            case START, PASS_SUCCEEDED -> JobStatus.PROCESSING;
            case COMPLETE              -> JobStatus.COMPLETED;
            case FAIL                  -> JobStatus.FAILED;
            case CANCEL                -> JobStatus.CANCELLED;
        };
    }

    public boolean allowedFrom(JobStatus status) {
        return switch (kind) {
            case START                         -> status == JobStatus.PENDING;
            case PASS_SUCCEEDED, COMPLETE, FAIL -> status == JobStatus.PROCESSING;
            case CANCEL                        -> status == JobStatus.PENDING || status == JobStatus.PROCESSING;
        };
    }
}
