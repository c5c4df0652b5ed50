package io.middleware4j.job;

import io.middleware4j.core.ExecutionMode;
import io.middleware4j.core.PipeKind;
import io.middleware4j.job.process.ProcessJobBody;

import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Static, per-method declaration of how a job-backed method is scheduled.
 *
 * <ul>
 *   <li>lock: lock name (constant or computed from the raw call arguments); jobs sharing a lock never run together</li>
 *   <li>lockQueueSize: how many jobs may wait on the lock; once full, submitting returns the job at the queue tail</li>
 *   <li>logs: open a per-job log file</li>
 *   <li>mode: LOOP, THREAD or PROCESS placement</li>
 *   <li>pipes / checkPipes: streams the job needs, and whether they must be attached before it starts</li>
 *   <li>transientJob: drop from the job table when finished and never emit ADDED/CHANGED</li>
 *   <li>abortable: accept abort requests</li>
 * </ul>
 */
public final class JobOptions {

    private static final JobOptions DEFAULTS = builder().build();

    private final Function<List<Object>, String> lock;
    private final Integer lockQueueSize;
    private final boolean logs;
    private final ExecutionMode mode;
    private final Set<PipeKind> pipes;
    private final boolean checkPipes;
    private final boolean transientJob;
    private final Function<List<Object>, String> description;
    private final boolean abortable;
    private final Class<? extends ProcessJobBody> processBody;

    private JobOptions(Builder b) {
        this.lock = b.lock;
        this.lockQueueSize = b.lockQueueSize;
        this.logs = b.logs;
        this.mode = b.mode;
        this.pipes = b.pipes.isEmpty() ? Set.of() : Set.copyOf(b.pipes);
        this.checkPipes = b.checkPipes;
        this.transientJob = b.transientJob;
        this.description = b.description;
        this.abortable = b.abortable;
        this.processBody = b.processBody;
    }

    public static JobOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Lock name for a call with these raw arguments, or null when the job is not locked.
     */
    public String resolveLock(List<Object> args) {
        return lock == null ? null : lock.apply(args);
    }

    public String resolveDescription(List<Object> args) {
        return description == null ? null : description.apply(args);
    }

    public Integer lockQueueSize() {
        return lockQueueSize;
    }

    public boolean logs() {
        return logs;
    }

    public ExecutionMode mode() {
        return mode;
    }

    public Set<PipeKind> pipes() {
        return pipes;
    }

    public boolean checkPipes() {
        return checkPipes;
    }

    public boolean isTransient() {
        return transientJob;
    }

    public boolean abortable() {
        return abortable;
    }

    public Class<? extends ProcessJobBody> processBody() {
        return processBody;
    }

    public static final class Builder {
        private Function<List<Object>, String> lock;
        private Integer lockQueueSize;
        private boolean logs;
        private ExecutionMode mode = ExecutionMode.LOOP;
        private final Set<PipeKind> pipes = EnumSet.noneOf(PipeKind.class);
        private boolean checkPipes = true;
        private boolean transientJob;
        private Function<List<Object>, String> description;
        private boolean abortable;
        private Class<? extends ProcessJobBody> processBody;

        public Builder lock(String lock) {
            Objects.requireNonNull(lock, "lock must not be null");
            if (lock.isBlank()) {
                throw new IllegalArgumentException("lock must not be blank");
            }
            this.lock = args -> lock;
            return this;
        }

        /**
         * Compute the lock name from the raw (unvalidated) call arguments, e.g. {@code args -> "scrub:" + args.get(0)}.
         */
        public Builder lock(Function<List<Object>, String> lock) {
            this.lock = Objects.requireNonNull(lock, "lock must not be null");
            return this;
        }

        public Builder lockQueueSize(int lockQueueSize) {
            if (lockQueueSize < 0) {
                throw new IllegalArgumentException("lockQueueSize must not be negative");
            }
            this.lockQueueSize = lockQueueSize;
            return this;
        }

        public Builder logs(boolean logs) {
            this.logs = logs;
            return this;
        }

        public Builder mode(ExecutionMode mode) {
            this.mode = Objects.requireNonNull(mode, "mode must not be null");
            return this;
        }

        public Builder process(Class<? extends ProcessJobBody> processBody) {
            this.processBody = Objects.requireNonNull(processBody, "processBody must not be null");
            this.mode = ExecutionMode.PROCESS;
            return this;
        }

        public Builder pipes(PipeKind... kinds) {
            this.pipes.clear();
            this.pipes.addAll(List.of(kinds));
            return this;
        }

        public Builder checkPipes(boolean checkPipes) {
            this.checkPipes = checkPipes;
            return this;
        }

        public Builder transientJob(boolean transientJob) {
            this.transientJob = transientJob;
            return this;
        }

        public Builder description(Function<List<Object>, String> description) {
            this.description = description;
            return this;
        }

        public Builder abortable(boolean abortable) {
            this.abortable = abortable;
            return this;
        }

        public JobOptions build() {
            if (mode == ExecutionMode.PROCESS && processBody == null) {
                throw new IllegalStateException("PROCESS mode requires a ProcessJobBody class");
            }
            if (lockQueueSize != null && lock == null) {
                throw new IllegalStateException("lockQueueSize requires a lock");
            }
            return new JobOptions(this);
        }
    }
}
