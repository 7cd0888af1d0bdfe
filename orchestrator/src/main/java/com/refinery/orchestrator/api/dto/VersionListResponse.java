package com.refinery.orchestrator.api.dto;

import java.util.List;

/** Response body for GET /files/{fileId}/versions: recorded pass numbers, ascending. */
public record VersionListResponse(String fileId, List<Integer> passes) {
}
