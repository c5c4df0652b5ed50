package io.middleware4j.replicated;

import io.middleware4j.core.VersionStamp;

/**
 * Raised by a {@link ReplicatedBackend} when a write carries a version other than the stored one. Nothing was
 * written.
 */
public class VersionConflictException extends RuntimeException {

    private final VersionStamp stored;

    public VersionConflictException(String name, VersionStamp stored) {
        super(name + ": stored version is " + stored);
        this.stored = stored;
    }

    public VersionStamp stored() {
        return stored;
    }
}
