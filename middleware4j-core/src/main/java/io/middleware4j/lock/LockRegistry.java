package io.middleware4j.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Process-wide mapping from a string key to a lock object, created lazily and never removed.
 *
 * <p>Creation is guarded by a registry-level lock so two callers can never end up with different lock objects
 * for the same key. Growth is visible through {@link #size()} and logged once the warn threshold is crossed.
 */
public abstract class LockRegistry<L> {
    private static final Logger log = LoggerFactory.getLogger(LockRegistry.class);

    private final String flavor;
    private final Function<String, L> factory;
    private final Object creationLock = new Object();
    private final Map<String, L> locks = new HashMap<>();
    private volatile int warnThreshold = 10_000;
    private boolean warned;

    protected LockRegistry(String flavor, Function<String, L> factory) {
        this.flavor = flavor;
        this.factory = factory;
    }

    protected L lockFor(String key) {
        Objects.requireNonNull(key, "lock key must not be null");
        synchronized (creationLock) {
            L lock = locks.get(key);
            if (lock == null) {
                lock = factory.apply(key);
                locks.put(key, lock);
                if (!warned && locks.size() >= warnThreshold) {
                    warned = true;
                    log.warn("{} lock registry holds {} keys; keys are never evicted, check for unbounded lock names",
                            flavor, locks.size());
                }
            }
            return lock;
        }
    }

    public int size() {
        synchronized (creationLock) {
            return locks.size();
        }
    }

    public void setWarnThreshold(int warnThreshold) {
        if (warnThreshold <= 0) {
            throw new IllegalArgumentException("warnThreshold must be positive");
        }
        this.warnThreshold = warnThreshold;
    }
}
