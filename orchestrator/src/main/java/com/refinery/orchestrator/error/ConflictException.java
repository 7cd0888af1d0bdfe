package com.refinery.orchestrator.error;

import java.util.Map;

/**
 * A write collided with existing durable state: a duplicate snapshot or a
 * concurrent event append that lost the sequence race. The stored state is
 * left untouched.
 */
public class ConflictException extends RefineryException {

    public ConflictException(String message, Map<String, Object> details) {
        super(ErrorCode.CONFLICT, message, details);
    }

    public ConflictException(String message, Map<String, Object> details, Throwable cause) {
        super(ErrorCode.CONFLICT, message, details, cause);
    }
}
