package io.middleware4j.service;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.LongSupplier;

/**
 * Allows at most one call per key within {@code period}. Throttled callers retry every {@link #RETRY_INTERVAL}
 * until their slot opens.
 *
 * <p>The optional condition maps call arguments to a {@link Decision}: {@code bypass} skips throttling altogether,
 * {@code key} selects the bucket.
 */
public final class Throttle {

    public static final Duration RETRY_INTERVAL = Duration.ofMillis(500);

    public record Decision(boolean bypass, Object key) {
    }

    private final long periodNanos;
    private final Function<List<Object>, Decision> condition;
    private final LongSupplier ticker;
    private final Map<Object, Long> lastCalls = new HashMap<>();

    public Throttle(Duration period) {
        this(period, null, System::nanoTime);
    }

    public Throttle(Duration period, Function<List<Object>, Decision> condition) {
        this(period, condition, System::nanoTime);
    }

    Throttle(Duration period, Function<List<Object>, Decision> condition, LongSupplier ticker) {
        Objects.requireNonNull(period, "period must not be null");
        if (period.isNegative()) {
            throw new IllegalArgumentException("period must not be negative");
        }
        this.periodNanos = period.toNanos();
        this.condition = condition;
        this.ticker = Objects.requireNonNull(ticker, "ticker must not be null");
    }

    /**
     * Wrap a method so every call passes through this throttle first.
     */
    public ServiceMethod wrap(ServiceMethod method) {
        return (job, args) -> {
            await(args);
            return method.invoke(job, args);
        };
    }

    /**
     * Block until the caller may proceed.
     */
    public void await(List<Object> args) throws InterruptedException {
        Object key = null;
        if (condition != null) {
            Decision decision = condition.apply(args);
            if (decision.bypass()) {
                return;
            }
            key = decision.key();
        }
        while (!register(key)) {
            Thread.sleep(RETRY_INTERVAL.toMillis());
        }
    }

    private synchronized boolean register(Object key) {
        long now = ticker.getAsLong();
        Long last = lastCalls.get(key);
        if (last == null || now - last > periodNanos) {
            lastCalls.put(key, now);
            return true;
        }
        return false;
    }
}
