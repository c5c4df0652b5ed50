package io.middleware4j.errors;

public class PipeNotReadyException extends MiddlewareException {

    public PipeNotReadyException(String message) {
        super(message, ErrorCode.EPIPE);
    }
}
