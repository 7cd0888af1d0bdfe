package com.refinery.orchestrator.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class for every domain error the orchestrator surfaces to callers.
 *
 * Unchecked so the service layer only catches it where it has a recovery
 * strategy; everything else propagates to ApiExceptionHandler, which turns
 * the code and details into the JSON error body.
 */
public abstract class RefineryException extends RuntimeException {

    private final ErrorCode code;
    private final Map<String, Object> details;

    protected RefineryException(ErrorCode code, String message, Map<String, Object> details) {
        super(message);
        this.code    = code;
        this.details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    protected RefineryException(ErrorCode code, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.code    = code;
        this.details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public ErrorCode getCode()              { return code; }
    public Map<String, Object> getDetails() { return details; }
}
