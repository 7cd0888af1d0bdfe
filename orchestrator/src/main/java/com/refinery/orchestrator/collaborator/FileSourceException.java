package com.refinery.orchestrator.collaborator;

/**
 * Thrown when the file-source service returns an error or is unreachable.
 */
public class FileSourceException extends RuntimeException {

    public FileSourceException(String message) {
        super(message);
    }

    public FileSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
