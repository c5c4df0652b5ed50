package io.middleware4j.errors;

/**
 * Root of every error raised by services and the job engine.
 *
 * <p>Expected errors (validation, not found, dependency, backend health, version) are user-actionable and are
 * surfaced verbatim. Anything else is operator-actionable.
 */
public class MiddlewareException extends RuntimeException {

    private final ErrorCode code;

    public MiddlewareException(String message, ErrorCode code) {
        super(message);
        this.code = code == null ? ErrorCode.EFAULT : code;
    }

    public MiddlewareException(String message, ErrorCode code, Throwable cause) {
        super(message, cause);
        this.code = code == null ? ErrorCode.EFAULT : code;
    }

    public ErrorCode code() {
        return code;
    }

    public boolean isExpected() {
        return true;
    }
}
