package com.refinery.orchestrator.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.refinery.orchestrator.error.ValidationException;

/**
 * Everything the Job Store needs to create a job in PENDING.
 */
public record NewJob(String fileId, String fileName, String userId,
                     int totalPasses, String model, JsonNode metadata) {

    /**
     * @throws ValidationException on the first invalid field
     */
    public void validate() {
        if (fileId == null || fileId.isBlank()) {
            throw new ValidationException("fileId", "fileId is required");
        }
        if (fileName == null || fileName.isBlank()) {
            throw new ValidationException("fileName", "fileName is required");
        }
        if (totalPasses < 1) {
            throw new ValidationException("totalPasses", "totalPasses must be >= 1, was " + totalPasses);
        }
        if (model == null || model.isBlank()) {
            throw new ValidationException("model", "model is required");
        }
        if (metadata != null && !metadata.isObject()) {
            throw new ValidationException("metadata", "metadata must be a JSON object");
        }
    }
}
