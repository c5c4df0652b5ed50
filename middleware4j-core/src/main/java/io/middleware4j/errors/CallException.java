package io.middleware4j.errors;

import java.util.Map;

/**
 * Generic call failure. Carries optional structured extra data for programmatic handling.
 */
public class CallException extends MiddlewareException {

    private final Map<String, Object> extra;

    public CallException(String message) {
        this(message, ErrorCode.EFAULT, Map.of());
    }

    public CallException(String message, ErrorCode code) {
        this(message, code, Map.of());
    }

    public CallException(String message, ErrorCode code, Map<String, Object> extra) {
        super(message, code);
        this.extra = extra == null ? Map.of() : Map.copyOf(extra);
    }

    public CallException(String message, ErrorCode code, Throwable cause) {
        super(message, code, cause);
        this.extra = Map.of();
    }

    public Map<String, Object> extra() {
        return extra;
    }

    @Override
    public boolean isExpected() {
        return code() != ErrorCode.EFAULT;
    }
}
