package io.middleware4j.lock;

import java.util.concurrent.CompletableFuture;

/**
 * Lock registry whose handles suspend a cooperatively scheduled caller instead of blocking its thread.
 */
public final class CooperativeLockRegistry extends LockRegistry<AsyncMutex> {

    public CooperativeLockRegistry() {
        super("cooperative", AsyncMutex::new);
    }

    public CompletableFuture<LockHandle> acquire(String key) {
        return lockFor(key).acquire();
    }

    public boolean isLocked(String key) {
        return lockFor(key).isHeld();
    }
}
