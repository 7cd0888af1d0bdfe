package com.refinery.orchestrator.api.dto;

import java.time.Instant;
import java.util.Map;

/**
 * Body of every error response.
 *
 * error is the ErrorCode name, status the HTTP status code.
 */
public record ErrorResponse(String error, String message, int status,
                            Map<String, Object> details, Instant timestamp) {
}
