package com.refinery.orchestrator.error;

import java.util.HashMap;
import java.util.Map;

/**
 * Malformed request, rejected before any state is written.
 */
public class ValidationException extends RefineryException {

    public ValidationException(String field, String message) {
        super(ErrorCode.VALIDATION_ERROR, message, fieldDetails(field));
    }

    private static Map<String, Object> fieldDetails(String field) {
        Map<String, Object> details = new HashMap<>();
        details.put("field", field);
        return details;
    }
}
