package io.middleware4j.errors;

public class InstanceNotFoundException extends MiddlewareException {

    public InstanceNotFoundException(String message) {
        super(message, ErrorCode.ENOENT);
    }
}
