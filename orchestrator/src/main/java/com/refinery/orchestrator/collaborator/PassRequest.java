package com.refinery.orchestrator.collaborator;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Input to one refinement pass.
 *
 * @param config per-job settings taken from the job's metadata "config" object
 *               (missing node when the job has none)
 */
public record PassRequest(String fileId,
                          int passNumber,
                          int totalPasses,
                          String currentContent,
                          String model,
                          JsonNode config) {
}
