package com.refinery.orchestrator.error;

/**
 * Failure reported by the refinement collaborator for one pass attempt.
 *
 * TRANSIENT failures (rate limits, 5xx, timeouts, I/O) are retried up to the
 * per-pass attempt bound. FATAL failures fail the job immediately.
 */
public class PassException extends RuntimeException {

    public enum Kind { TRANSIENT, FATAL }

    private final Kind kind;

    public PassException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public PassException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static PassException transientFailure(String message) {
        return new PassException(Kind.TRANSIENT, message);
    }

    public static PassException fatal(String message) {
        return new PassException(Kind.FATAL, message);
    }

    public Kind getKind() { return kind; }

    public boolean isRetryable() { return kind == Kind.TRANSIENT; }
}
