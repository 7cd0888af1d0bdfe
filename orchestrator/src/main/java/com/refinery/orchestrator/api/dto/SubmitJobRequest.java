package com.refinery.orchestrator.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.refinery.orchestrator.store.NewJob;

/**
 * Request body for POST /jobs.
 *
 * Required: fileId, fileName, totalPasses
 * Optional: userId, model (defaults to "gpt-4"), metadata (a JSON object;
 *   its "config" member is handed to the refiner on every pass)
 */
public record SubmitJobRequest(String fileId, String fileName, String userId,
                               Integer totalPasses, String model, JsonNode metadata) {

    public static final String DEFAULT_MODEL = "gpt-4";

    // Compact constructor: default the model; a missing totalPasses fails validation.
    public SubmitJobRequest {
        if (model == null || model.isBlank()) model = DEFAULT_MODEL;
        if (totalPasses == null) totalPasses = 0;
    }

    public NewJob toNewJob() {
        return new NewJob(fileId, fileName, userId, totalPasses, model, metadata);
    }
}
