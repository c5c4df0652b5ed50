package io.middleware4j.config;

import io.middleware4j.Middleware;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongSupplier;

/**
 * Bridges middleware start/stop with the Spring container lifecycle.
 *
 * <p>Runs in {@link #PHASE}, below the embedded web server, so the middleware is up before HTTP calls arrive and
 * is stopped only after the server has drained. A stop slower than {@code middleware.shutdown-timeout} is reported.
 */
public class MiddlewareLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(MiddlewareLifecycle.class);

    /** Below the web server's {@code DEFAULT_PHASE - 1024}. */
    public static final int PHASE = SmartLifecycle.DEFAULT_PHASE - 2048;

    private final Middleware middleware;
    private final MiddlewareProperties props;
    private final LongSupplier ticker;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public MiddlewareLifecycle(Middleware middleware, MiddlewareProperties props) {
        this(middleware, props, System::nanoTime);
    }

    MiddlewareLifecycle(Middleware middleware, MiddlewareProperties props, LongSupplier ticker) {
        this.middleware = Objects.requireNonNull(middleware, "middleware must not be null");
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.ticker = Objects.requireNonNull(ticker, "ticker must not be null");
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        try {
            middleware.start();
        } catch (RuntimeException e) {
            running.set(false);
            throw e;
        }
        log.info("Middleware running services={}", middleware.services().all().size());
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        long begin = ticker.getAsLong();
        middleware.stop();
        Duration took = Duration.ofNanos(ticker.getAsLong() - begin);
        if (took.compareTo(props.getShutdownTimeout()) > 0) {
            log.warn("Middleware stop took {}ms, above shutdownTimeout={}ms", took.toMillis(),
                    props.getShutdownTimeout().toMillis());
        } else {
            log.info("Middleware stopped in {}ms", took.toMillis());
        }
    }

    /**
     * The callback runs even when stopping fails.
     */
    @Override
    public void stop(Runnable callback) {
        try {
            stop();
        } finally {
            callback.run();
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        return PHASE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
