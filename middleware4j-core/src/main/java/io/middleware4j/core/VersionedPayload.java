package io.middleware4j.core;

/**
 * Data as held by the replicated backend, together with the version stamp it was written with.
 * Both fields are null when nothing was ever written.
 */
public record VersionedPayload<T>(VersionStamp version, T data) {

    public static <T> VersionedPayload<T> empty() {
        return new VersionedPayload<>(null, null);
    }
}
