package io.middleware4j.service;

import io.middleware4j.job.JobOptions;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-method metadata declared at registration time.
 *
 * <ul>
 *   <li>privateMethod: callable internally only</li>
 *   <li>itemMethod: operates on one entry, its first argument is the entry id</li>
 *   <li>job: run as a managed job with these options; the call then returns the {@link io.middleware4j.job.Job}</li>
 *   <li>lock: serialize plain calls of this method through the lock registry</li>
 *   <li>threadPool: the method blocks, so its {@code lock} is taken with the blocking flavor. Plain calls run on the
 *   caller's thread either way; declare a THREAD job to move work off it</li>
 *   <li>periodic: run on a fixed schedule once the middleware starts</li>
 * </ul>
 */
public final class MethodDescriptor {

    private final String name;
    private final ServiceMethod handler;
    private final boolean privateMethod;
    private final boolean itemMethod;
    private final JobOptions job;
    private final String lock;
    private final boolean threadPool;
    private final Duration periodicInterval;
    private final boolean periodicRunOnStart;

    private MethodDescriptor(Builder b) {
        this.name = b.name;
        this.handler = b.handler;
        this.privateMethod = b.privateMethod;
        this.itemMethod = b.itemMethod;
        this.job = b.job;
        this.lock = b.lock;
        this.threadPool = b.threadPool;
        this.periodicInterval = b.periodicInterval;
        this.periodicRunOnStart = b.periodicRunOnStart;
    }

    public static Builder builder(String name, ServiceMethod handler) {
        return new Builder(name, handler);
    }

    public String name() {
        return name;
    }

    public ServiceMethod handler() {
        return handler;
    }

    public boolean privateMethod() {
        return privateMethod;
    }

    public boolean itemMethod() {
        return itemMethod;
    }

    public JobOptions job() {
        return job;
    }

    public boolean isJob() {
        return job != null;
    }

    public String lock() {
        return lock;
    }

    public boolean threadPool() {
        return threadPool;
    }

    public Duration periodicInterval() {
        return periodicInterval;
    }

    public boolean periodicRunOnStart() {
        return periodicRunOnStart;
    }

    public boolean isPeriodic() {
        return periodicInterval != null;
    }

    /**
     * Same metadata, marked private.
     */
    public MethodDescriptor asPrivate() {
        Builder b = new Builder(name, handler);
        b.privateMethod = true;
        b.itemMethod = itemMethod;
        b.job = job;
        b.lock = lock;
        b.threadPool = threadPool;
        b.periodicInterval = periodicInterval;
        b.periodicRunOnStart = periodicRunOnStart;
        return b.build();
    }

    @Override
    public String toString() {
        return "MethodDescriptor{name=" + name + ", job=" + isJob() + ", private=" + privateMethod + "}";
    }

    public static final class Builder {
        private final String name;
        private final ServiceMethod handler;
        private boolean privateMethod;
        private boolean itemMethod;
        private JobOptions job;
        private String lock;
        private boolean threadPool;
        private Duration periodicInterval;
        private boolean periodicRunOnStart = true;

        private Builder(String name, ServiceMethod handler) {
            Objects.requireNonNull(name, "name must not be null");
            if (name.isBlank() || name.contains(".")) {
                throw new IllegalArgumentException("invalid method name: " + name);
            }
            this.name = name;
            this.handler = Objects.requireNonNull(handler, "handler must not be null");
        }

        public Builder privateMethod(boolean privateMethod) {
            this.privateMethod = privateMethod;
            return this;
        }

        public Builder itemMethod(boolean itemMethod) {
            this.itemMethod = itemMethod;
            return this;
        }

        public Builder job(JobOptions job) {
            this.job = Objects.requireNonNull(job, "job must not be null");
            return this;
        }

        public Builder lock(String lock) {
            this.lock = lock;
            return this;
        }

        public Builder threadPool(boolean threadPool) {
            this.threadPool = threadPool;
            return this;
        }

        public Builder periodic(Duration interval, boolean runOnStart) {
            Objects.requireNonNull(interval, "interval must not be null");
            if (interval.isZero() || interval.isNegative()) {
                throw new IllegalArgumentException("periodic interval must be a positive duration");
            }
            this.periodicInterval = interval;
            this.periodicRunOnStart = runOnStart;
            return this;
        }

        public MethodDescriptor build() {
            if (job != null && lock != null) {
                throw new IllegalStateException("job methods declare their lock in JobOptions");
            }
            return new MethodDescriptor(this);
        }
    }
}
