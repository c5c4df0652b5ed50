package io.middleware4j.lock;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Lock registry whose handles block the calling worker thread.
 */
public final class BlockingLockRegistry extends LockRegistry<ReentrantLock> {

    public BlockingLockRegistry() {
        super("blocking", key -> new ReentrantLock(true));
    }

    public LockHandle acquire(String key) {
        ReentrantLock lock = lockFor(key);
        lock.lock();
        return handle(key, lock);
    }

    public LockHandle acquireInterruptibly(String key) throws InterruptedException {
        ReentrantLock lock = lockFor(key);
        lock.lockInterruptibly();
        return handle(key, lock);
    }

    public boolean isLocked(String key) {
        return lockFor(key).isLocked();
    }

    private static LockHandle handle(String key, ReentrantLock lock) {
        AtomicBoolean open = new AtomicBoolean(true);
        return new LockHandle() {
            @Override
            public String key() {
                return key;
            }

            @Override
            public void close() {
                if (open.compareAndSet(true, false)) {
                    lock.unlock();
                }
            }
        };
    }
}
