package io.middleware4j.lock;

/**
 * The two process-wide lock tables.
 *
 * <p>Both are keyed by the same string namespace but are independent: a cooperative caller and a blocking caller
 * using the same key are serialized only against callers of their own flavor, never against each other.
 */
public final class Locks {

    public static final CooperativeLockRegistry COOPERATIVE = new CooperativeLockRegistry();
    public static final BlockingLockRegistry BLOCKING = new BlockingLockRegistry();

    private Locks() {
    }
}
