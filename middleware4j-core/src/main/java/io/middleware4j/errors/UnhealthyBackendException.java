package io.middleware4j.errors;

public class UnhealthyBackendException extends MiddlewareException {

    public UnhealthyBackendException(String message) {
        super(message, ErrorCode.EREMOTEIO);
    }
}
