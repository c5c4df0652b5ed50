package io.middleware4j.lock;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Non-blocking FIFO mutex for callers running on the cooperative scheduler.
 *
 * <p>{@link #acquire()} never blocks: it returns a future completed once the caller owns the mutex. A waiter whose
 * future is cancelled before it is granted is skipped.
 */
public final class AsyncMutex {

    private final String key;
    private final Deque<CompletableFuture<LockHandle>> waiters = new ArrayDeque<>();
    private boolean held;

    AsyncMutex(String key) {
        this.key = key;
    }

    public CompletableFuture<LockHandle> acquire() {
        synchronized (this) {
            if (!held) {
                held = true;
                return CompletableFuture.completedFuture(newHandle());
            }
            CompletableFuture<LockHandle> waiter = new CompletableFuture<>();
            waiters.addLast(waiter);
            return waiter;
        }
    }

    public synchronized boolean isHeld() {
        return held;
    }

    public synchronized int queued() {
        return waiters.size();
    }

    private void release() {
        CompletableFuture<LockHandle> next;
        synchronized (this) {
            while (true) {
                next = waiters.pollFirst();
                if (next == null) {
                    held = false;
                    return;
                }
                if (!next.isDone()) {
                    break;
                }
            }
        }
        if (!next.complete(newHandle())) {
            // cancelled between poll and complete
            release();
        }
    }

    private LockHandle newHandle() {
        AtomicBoolean open = new AtomicBoolean(true);
        return new LockHandle() {
            @Override
            public String key() {
                return key;
            }

            @Override
            public void close() {
                if (open.compareAndSet(true, false)) {
                    release();
                }
            }
        };
    }
}
