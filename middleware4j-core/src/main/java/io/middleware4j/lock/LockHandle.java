package io.middleware4j.lock;

/**
 * Scoped ownership of a registry lock. Closing it releases the lock; closing twice is a no-op.
 */
public interface LockHandle extends AutoCloseable {

    String key();

    @Override
    void close();
}
