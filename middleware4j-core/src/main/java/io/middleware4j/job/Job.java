package io.middleware4j.job;

import io.middleware4j.core.JobProgress;
import io.middleware4j.core.JobState;
import io.middleware4j.core.PipeKind;
import io.middleware4j.errors.CallException;
import io.middleware4j.errors.ErrorCode;
import io.middleware4j.errors.MiddlewareException;
import io.middleware4j.errors.PipeNotReadyException;

import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ForkJoinWorkerThread;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * A trackable unit of possibly long-running work.
 *
 * <p>State is owned by the {@link JobScheduler}; the running body may only report progress, write logs and use
 * its pipes. {@link #completion()} completes when the job reaches a terminal state: normally with the result,
 * exceptionally with the failure, or cancelled when the job was aborted.
 */
public class Job {

    private final long id;
    private final String method;
    private final List<Object> arguments;
    private final JobOptions options;
    private final String lockName;
    private final Pipes pipes;
    private final Instant createdAt;
    private final JobObserver observer;
    private final CompletableFuture<Object> completion = new CompletableFuture<>();

    private volatile String description;
    private volatile JobState state;
    private volatile JobProgress progress = JobProgress.empty();
    private volatile Object result;
    private volatile String error;
    private volatile String exception;
    private volatile Map<String, Object> excInfo;
    private volatile Instant startedAt;
    private volatile Instant finishedAt;

    private volatile boolean abortRequested;
    private Thread boundThread;

    private volatile JobLogFile logFile;
    private volatile String logsExcerpt;

    Job(long id, String method, List<Object> arguments, JobOptions options, String lockName, Pipes pipes,
        Instant createdAt, JobObserver observer) {
        this.id = id;
        this.method = method;
        this.arguments = arguments == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(arguments));
        this.options = options;
        this.lockName = lockName;
        this.pipes = pipes == null ? Pipes.none() : pipes;
        this.createdAt = createdAt;
        this.observer = observer;
        this.description = options.resolveDescription(this.arguments);
        this.state = JobState.WAITING;
    }

    public long id() {
        return id;
    }

    public String method() {
        return method;
    }

    public List<Object> arguments() {
        return arguments;
    }

    public JobOptions options() {
        return options;
    }

    public String lockName() {
        return lockName;
    }

    public JobState state() {
        return state;
    }

    public JobProgress progress() {
        return progress;
    }

    public Object result() {
        return result;
    }

    public String error() {
        return error;
    }

    public String exception() {
        return exception;
    }

    public String description() {
        return description;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant finishedAt() {
        return finishedAt;
    }

    public Pipes pipes() {
        return pipes;
    }

    public CompletableFuture<Object> completion() {
        return completion;
    }

    public boolean isAbortRequested() {
        return abortRequested;
    }

    public void setDescription(String description) {
        this.description = description;
        observer.onChanged(this);
    }

    public void setProgress(double percent) {
        setProgress(percent, null, null);
    }

    public void setProgress(double percent, String description) {
        setProgress(percent, description, null);
    }

    /**
     * Report progress. Null arguments keep the previous value.
     */
    public void setProgress(Double percent, String description, Object extra) {
        JobProgress old = progress;
        progress = new JobProgress(
                percent != null ? percent : old.percent(),
                description != null ? description : old.description(),
                extra != null ? extra : old.extra()
        );
        observer.onChanged(this);
    }

    /**
     * Make sure the given pipe is attached, for jobs that opted out of the scheduler's pipe precheck.
     */
    public Pipe checkPipe(PipeKind kind) {
        if (!options.pipes().contains(kind)) {
            throw new IllegalStateException("Job " + method + " does not declare a " + kind + " pipe");
        }
        Pipe pipe = pipes.get(kind);
        if (pipe == null) {
            throw new PipeNotReadyException(kind.name().toLowerCase() + " pipe is not set");
        }
        return pipe;
    }

    /**
     * Per-job log stream; only available when the job was declared with logs enabled.
     */
    public OutputStream logs() {
        JobLogFile f = logFile;
        if (f == null) {
            throw new IllegalStateException("Job " + method + " was not declared with logs");
        }
        return f.stream();
    }

    public Path logsPath() {
        JobLogFile f = logFile;
        return f == null ? null : f.path();
    }

    public String logsExcerpt() {
        return logsExcerpt;
    }

    /**
     * Request cancellation. Only honored for abortable jobs.
     */
    public void abort() {
        observer.onAbort(this);
    }

    /**
     * Block until the job finishes and return its result.
     *
     * @throws MiddlewareException the job's own failure when it was an expected error, otherwise a
     *                             {@link CallException} carrying the job's error message
     */
    public Object await() throws InterruptedException {
        try {
            awaitDone();
            return completion.get();
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        } catch (CancellationException e) {
            throw new CallException("Job " + id + " was aborted", ErrorCode.EFAULT);
        }
    }

    public Object await(Duration timeout) throws InterruptedException, TimeoutException {
        try {
            return completion.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        } catch (CancellationException e) {
            throw new CallException("Job " + id + " was aborted", ErrorCode.EFAULT);
        }
    }

    /**
     * Wait for another job, mirroring its progress onto this one, and return its result.
     */
    public Object wrap(Job other) throws InterruptedException {
        other.observer.subscribeProgress(other, p -> setProgress(p.percent(), p.description(), p.extra()));
        try {
            return other.await();
        } finally {
            JobProgress last = other.progress();
            setProgress(last.percent(), last.description(), last.extra());
        }
    }

    /**
     * Block until {@link #completion()} is done. On a {@link ForkJoinPool} worker (the LOOP scheduler) the wait is
     * managed, so the pool keeps running other jobs, including the one being waited for.
     */
    private void awaitDone() throws InterruptedException {
        if (completion.isDone() || !(Thread.currentThread() instanceof ForkJoinWorkerThread)) {
            return;
        }
        CountDownLatch done = new CountDownLatch(1);
        completion.whenComplete((value, failure) -> done.countDown());
        ForkJoinPool.managedBlock(new ForkJoinPool.ManagedBlocker() {
            @Override
            public boolean block() throws InterruptedException {
                done.await();
                return true;
            }

            @Override
            public boolean isReleasable() {
                return done.getCount() == 0;
            }
        });
    }

    private RuntimeException unwrap(Throwable cause) {
        if (cause instanceof RuntimeException re) {
            return re;
        }
        return new CallException(cause == null ? "Job " + id + " failed" : String.valueOf(cause.getMessage()),
                ErrorCode.EFAULT);
    }

    /**
     * Encoded form as listed by {@code core.get_jobs}.
     */
    public Map<String, Object> encode() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", id);
        m.put("method", method);
        m.put("arguments", arguments);
        m.put("transient", options.isTransient());
        m.put("description", description);
        m.put("abortable", options.abortable());
        Path logs = logsPath();
        m.put("logs_path", logs == null ? null : logs.toString());
        m.put("logs_excerpt", logsExcerpt);
        JobProgress p = progress;
        Map<String, Object> pm = new LinkedHashMap<>();
        pm.put("percent", p.percent());
        pm.put("description", p.description());
        pm.put("extra", p.extra());
        m.put("progress", pm);
        m.put("result", result);
        m.put("error", error);
        m.put("exception", exception);
        m.put("exc_info", excInfo);
        m.put("state", state.name());
        m.put("time_started", startedAt);
        m.put("time_finished", finishedAt);
        return m;
    }

    // ---- scheduler-side transitions ----

    synchronized void markRunning(Instant now) {
        state = JobState.RUNNING;
        startedAt = now;
    }

    void openLogs(Path dir) throws IOException {
        logFile = JobLogFile.open(dir, id);
    }

    /**
     * Move to a terminal state. Returns false when the job had already finished.
     */
    synchronized boolean finish(JobState terminal, Object value, Throwable failure, Instant now, int excerptLines) {
        if (state.isFinished()) {
            return false;
        }
        if (!terminal.isFinished()) {
            throw new IllegalArgumentException("not a terminal state: " + terminal);
        }
        state = terminal;
        finishedAt = now;
        if (terminal == JobState.SUCCESS) {
            result = value;
        } else if (failure != null) {
            error = failure.getMessage() == null ? failure.getClass().getSimpleName() : failure.getMessage();
            Map<String, Object> info = new LinkedHashMap<>();
            info.put("repr", failure.toString());
            info.put("type", failure.getClass().getSimpleName());
            info.put("extra", failure instanceof CallException ce && !ce.extra().isEmpty() ? ce.extra() : null);
            excInfo = info;
            if (!(failure instanceof MiddlewareException me && me.isExpected())) {
                StringWriter sw = new StringWriter();
                failure.printStackTrace(new PrintWriter(sw));
                exception = sw.toString();
            }
        }
        JobLogFile f = logFile;
        if (f != null) {
            logsExcerpt = f.closeAndExcerpt(excerptLines);
        }

        switch (terminal) {
            case SUCCESS -> completion.complete(value);
            case FAILED -> completion.completeExceptionally(failure != null ? failure
                    : new CallException("Job " + id + " failed"));
            case ABORTED -> completion.cancel(false);
            default -> {
            }
        }
        return true;
    }

    synchronized void requestAbort() {
        abortRequested = true;
    }

    synchronized void bindThread(Thread thread) {
        boundThread = thread;
    }

    synchronized void unbindThread() {
        boundThread = null;
        // drop an interrupt aimed at this job so it cannot leak into the next one on the same thread
        Thread.interrupted();
    }

    synchronized void interruptBoundThread() {
        if (boundThread != null) {
            boundThread.interrupt();
        }
    }

    @Override
    public String toString() {
        return "Job{id=" + id + ", method=" + method + ", state=" + state + ", lock=" + lockName + "}";
    }
}
