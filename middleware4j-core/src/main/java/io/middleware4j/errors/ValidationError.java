package io.middleware4j.errors;

/**
 * A single validation failure, addressed by a dotted attribute path (e.g. {@code pool_create.name}).
 */
public record ValidationError(String attribute, String message, ErrorCode code) {

    public ValidationError(String attribute, String message) {
        this(attribute, message, ErrorCode.EINVAL);
    }

    @Override
    public String toString() {
        return "[" + code + "] " + attribute + ": " + message;
    }
}
