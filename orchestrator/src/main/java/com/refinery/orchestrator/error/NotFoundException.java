package com.refinery.orchestrator.error;

import java.util.Map;

/**
 * Unknown job, file or pass.
 */
public class NotFoundException extends RefineryException {

    public NotFoundException(String resource, Object identifier) {
        super(ErrorCode.NOT_FOUND, resource + " not found: " + identifier,
                Map.of("resource", resource, "identifier", String.valueOf(identifier)));
    }
}
