package io.middleware4j.errors;

/**
 * errno-like codes attached to every {@link MiddlewareException}.
 */
public enum ErrorCode {
    EINVAL(22),
    ENOENT(2),
    EBUSY(16),
    EPIPE(32),
    EPROTO(71),
    EREMOTEIO(121),
    ENOMETHOD(38),
    EFAULT(14);

    private final int value;

    ErrorCode(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }
}
