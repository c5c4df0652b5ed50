package io.middleware4j.errors;

import io.middleware4j.core.VersionStamp;

/**
 * Raised when a write targets stored data whose version stamp differs from the compiled-in one.
 */
public class VersionMismatchException extends MiddlewareException {

    private final VersionStamp local;
    private final VersionStamp stored;

    public VersionMismatchException(String namespace, VersionStamp local, VersionStamp stored) {
        super(namespace + ": service version mismatch. Node: " + local + ", cluster: "
                + (stored == null ? "unknown" : stored.toString()), ErrorCode.EPROTO);
        this.local = local;
        this.stored = stored;
    }

    public VersionStamp local() {
        return local;
    }

    public VersionStamp stored() {
        return stored;
    }
}
