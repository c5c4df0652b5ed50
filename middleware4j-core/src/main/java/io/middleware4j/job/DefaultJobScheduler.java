package io.middleware4j.job;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.middleware4j.JobBody;
import io.middleware4j.config.MiddlewareProperties;
import io.middleware4j.core.EventType;
import io.middleware4j.core.ExecutionMode;
import io.middleware4j.core.Filter;
import io.middleware4j.core.JobProgress;
import io.middleware4j.core.JobState;
import io.middleware4j.core.PipeKind;
import io.middleware4j.core.QueryOptions;
import io.middleware4j.core.QueryResult;
import io.middleware4j.datastore.FilterEngine;
import io.middleware4j.errors.CallException;
import io.middleware4j.errors.ErrorCode;
import io.middleware4j.errors.InstanceNotFoundException;
import io.middleware4j.errors.MiddlewareException;
import io.middleware4j.errors.PipeNotReadyException;
import io.middleware4j.event.EventSink;
import io.middleware4j.job.process.ProcessJobRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ForkJoinWorkerThread;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * In-process job scheduler.
 *
 * <p>Execution placement:
 * <ul>
 *   <li>LOOP: a single cooperative scheduler thread ({@code middleware.loop}). A LOOP body that waits on another
 *   job through {@link Job#await()} or {@link Job#wrap(Job)} releases the loop: the pool starts a compensating
 *   thread for the duration of the wait.</li>
 *   <li>THREAD: a bounded worker pool ({@code middleware.worker})</li>
 *   <li>PROCESS: a bounded pool of threads each supervising one child JVM ({@code middleware.process})</li>
 * </ul>
 *
 * <p>The lock queues and the job table are the single point of truth for job state. Admission and promotion are
 * serialized on the scheduler monitor; job bodies always run outside it.
 *
 * <p>Aborting a THREAD or PROCESS job only disowns it: the job turns ABORTED immediately but its lock stays held
 * until the underlying execution actually ends, so the next job on that lock never overlaps with it.
 */
public class DefaultJobScheduler implements JobScheduler, JobObserver {
    private static final Logger log = LoggerFactory.getLogger(DefaultJobScheduler.class);

    public static final String JOBS_EVENT = "core.get_jobs";

    private final MiddlewareProperties props;
    private final EventSink events;
    private final ProcessJobRunner processRunner;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicLong ids = new AtomicLong();
    private final Map<Long, Job> jobs = new ConcurrentSkipListMap<>();
    private final Map<String, LockQueue> lockQueues = new HashMap<>();
    private final Map<Long, List<Consumer<JobProgress>>> progressListeners = new ConcurrentHashMap<>();
    private final Map<Long, JobBody> bodies = new ConcurrentHashMap<>();

    private ExecutorService loop;
    private ExecutorService workerPool;
    private ExecutorService processPool;

    private static final class LockQueue {
        private final String name;
        private Job holder;
        private final Deque<Job> waiting = new ArrayDeque<>();

        private LockQueue(String name) {
            this.name = name;
        }
    }

    public DefaultJobScheduler(MiddlewareProperties props, EventSink events, ObjectMapper objectMapper) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.events = Objects.requireNonNull(events, "events must not be null");
        this.processRunner = new ProcessJobRunner(Objects.requireNonNull(objectMapper, "objectMapper must not be null"));
    }

    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        if (props.getThreadPoolSize() <= 0) {
            throw new IllegalArgumentException("middleware.threadPoolSize must be positive");
        }
        if (props.getProcessPoolSize() <= 0) {
            throw new IllegalArgumentException("middleware.processPoolSize must be positive");
        }

        log.info("Job scheduler starting with threadPoolSize={}, processPoolSize={}, jobLogsDir={}",
                props.getThreadPoolSize(), props.getProcessPoolSize(), props.getJobLogsDir());

        loop = new ForkJoinPool(1, loopFactory(), null, true);
        workerPool = Executors.newFixedThreadPool(props.getThreadPoolSize(), daemonFactory("middleware.worker"));
        processPool = Executors.newFixedThreadPool(props.getProcessPoolSize(), daemonFactory("middleware.process"));
        log.info("Job scheduler started successfully.");
    }

    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        log.info("Job scheduler stopping...");
        for (ExecutorService pool : List.of(loop, workerPool, processPool)) {
            pool.shutdown();
        }
        long timeoutMs = props.getShutdownTimeout().toMillis();
        for (ExecutorService pool : List.of(loop, workerPool, processPool)) {
            try {
                if (!pool.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS)) {
                    pool.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                pool.shutdownNow();
            }
        }
        log.info("Job scheduler stopped successfully.");
    }

    public boolean isStarted() {
        return started.get();
    }

    @Override
    public Job submit(String method, List<Object> arguments, JobOptions options, JobBody body, Pipes pipes) {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(options, "options must not be null");
        if (body == null && options.mode() != ExecutionMode.PROCESS) {
            throw new IllegalArgumentException("body must not be null for " + options.mode() + " jobs");
        }
        if (!started.get()) {
            throw new IllegalStateException("Job scheduler is not started");
        }

        List<Object> args = arguments == null ? List.of() : arguments;
        String lockName = options.resolveLock(args);
        Job job;

        synchronized (this) {
            if (lockName != null) {
                LockQueue queue = lockQueues.computeIfAbsent(lockName, LockQueue::new);
                if (queue.holder != null) {
                    Integer max = options.lockQueueSize();
                    if (max != null && queue.waiting.size() >= max && !queue.waiting.isEmpty()) {
                        Job tail = queue.waiting.peekLast();
                        log.debug("lock queue full lock={} size={} method={}; returning queued job id={}",
                                lockName, queue.waiting.size(), method, tail.id());
                        return tail;
                    }
                    job = newJob(method, args, options, lockName, pipes, body);
                    queue.waiting.addLast(job);
                    register(job);
                    log.debug("job queued id={} method={} lock={} position={}",
                            job.id(), method, lockName, queue.waiting.size());
                    return job;
                }
                job = newJob(method, args, options, lockName, pipes, body);
                queue.holder = job;
            } else {
                job = newJob(method, args, options, null, pipes, body);
            }
            register(job);
        }

        run(job);
        return job;
    }

    private Job newJob(String method, List<Object> args, JobOptions options, String lockName, Pipes pipes,
                       JobBody body) {
        Job job = new Job(ids.incrementAndGet(), method, args, options, lockName, pipes, Instant.now(), this);
        bodies.put(job.id(), body != null ? body : j -> processRunner.run(j, options.processBody()));
        return job;
    }

    private void register(Job job) {
        jobs.put(job.id(), job);
        if (!job.options().isTransient()) {
            events.send(JOBS_EVENT, EventType.ADDED, job.id(), job.encode());
        }
    }

    private void run(Job job) {
        if (job.options().checkPipes()) {
            for (PipeKind kind : job.options().pipes()) {
                if (!job.pipes().has(kind)) {
                    complete(job, JobState.FAILED, null,
                            new PipeNotReadyException(kind.name().toLowerCase() + " pipe is not set"));
                    release(job);
                    return;
                }
            }
        }

        job.markRunning(Instant.now());
        log.debug("job started id={} method={} mode={} lock={}",
                job.id(), job.method(), job.options().mode(), job.lockName());
        notifyChanged(job);

        if (job.options().logs()) {
            try {
                job.openLogs(props.getJobLogsDir());
            } catch (Exception e) {
                complete(job, JobState.FAILED, null, e);
                release(job);
                return;
            }
        }

        try {
            executorFor(job.options().mode()).execute(() -> execute(job));
        } catch (RejectedExecutionException e) {
            log.error("job rejected id={} method={} msg={}", job.id(), job.method(), e.getMessage(), e);
            complete(job, JobState.FAILED, null, e);
            release(job);
        }
    }

    private ExecutorService executorFor(ExecutionMode mode) {
        return switch (mode) {
            case LOOP -> loop;
            case THREAD -> workerPool;
            case PROCESS -> processPool;
        };
    }

    private void execute(Job job) {
        JobBody body = bodies.remove(job.id());
        job.bindThread(Thread.currentThread());
        try {
            if (job.isAbortRequested()) {
                throw new CancellationException("aborted before start");
            }
            Object result = body.run(job);
            if (job.isAbortRequested()) {
                complete(job, JobState.ABORTED, null, null);
            } else {
                complete(job, JobState.SUCCESS, result, null);
            }
        } catch (InterruptedException | CancellationException e) {
            if (job.isAbortRequested()) {
                complete(job, JobState.ABORTED, null, null);
            } else {
                complete(job, JobState.FAILED, null, e);
            }
        } catch (Throwable t) {
            complete(job, job.isAbortRequested() ? JobState.ABORTED : JobState.FAILED, null, t);
        } finally {
            job.unbindThread();
            release(job);
        }
    }

    private void complete(Job job, JobState state, Object result, Throwable failure) {
        if (!job.finish(state, result, failure, Instant.now(), props.getJobLogsExcerptLines())) {
            log.debug("job already finished id={} state={}; discarding {} outcome", job.id(), job.state(), state);
            return;
        }
        progressListeners.remove(job.id());

        if (state == JobState.FAILED) {
            if (failure instanceof MiddlewareException me && me.isExpected()) {
                log.debug("job failed id={} method={} code={} msg={}", job.id(), job.method(), me.code(),
                        me.getMessage());
            } else {
                log.error("job failed id={} method={} msg={}", job.id(), job.method(),
                        failure == null ? null : failure.getMessage(), failure);
            }
        } else {
            log.debug("job finished id={} method={} state={}", job.id(), job.method(), state);
        }

        if (job.options().isTransient()) {
            jobs.remove(job.id());
        } else {
            events.send(JOBS_EVENT, EventType.CHANGED, job.id(), job.encode());
        }
    }

    private void release(Job job) {
        if (job.lockName() == null) {
            return;
        }
        Job next = null;
        synchronized (this) {
            LockQueue queue = lockQueues.get(job.lockName());
            if (queue == null || queue.holder != job) {
                return;
            }
            queue.holder = null;
            while (!queue.waiting.isEmpty()) {
                Job candidate = queue.waiting.pollFirst();
                if (!candidate.state().isFinished()) {
                    next = candidate;
                    queue.holder = candidate;
                    break;
                }
            }
        }
        if (next != null) {
            log.debug("lock handed over lock={} from={} to={}", job.lockName(), job.id(), next.id());
            run(next);
        }
    }

    private void notifyChanged(Job job) {
        if (!job.options().isTransient()) {
            events.send(JOBS_EVENT, EventType.CHANGED, job.id(), job.encode());
        }
    }

    @Override
    public Optional<Job> get(long id) {
        return Optional.ofNullable(jobs.get(id));
    }

    @Override
    public List<Job> all() {
        List<Job> out = new ArrayList<>();
        for (Job job : jobs.values()) {
            if (job.options().isTransient() && job.state().isFinished()) {
                continue;
            }
            out.add(job);
        }
        return out;
    }

    @Override
    public QueryResult query(List<Filter> filters, QueryOptions options) {
        List<Map<String, Object>> encoded = new ArrayList<>();
        for (Job job : all()) {
            encoded.add(job.encode());
        }
        return FilterEngine.apply(encoded, filters, options);
    }

    @Override
    public void abort(long id) {
        Job job = jobs.get(id);
        if (job == null) {
            throw new InstanceNotFoundException("Job " + id + " does not exist");
        }
        onAbort(job);
    }

    @Override
    public int reap(Duration olderThan) {
        Instant cutoff = Instant.now().minus(olderThan);
        AtomicInteger removed = new AtomicInteger();
        jobs.values().removeIf(job -> {
            Instant finished = job.finishedAt();
            boolean stale = job.state().isFinished() && finished != null && finished.isBefore(cutoff);
            if (stale) {
                removed.incrementAndGet();
            }
            return stale;
        });
        if (removed.get() > 0) {
            log.debug("reaped finished jobs count={} olderThan={}", removed.get(), olderThan);
        }
        return removed.get();
    }

    // ---- JobObserver ----

    @Override
    public void onChanged(Job job) {
        List<Consumer<JobProgress>> listeners = progressListeners.get(job.id());
        if (listeners != null) {
            for (Consumer<JobProgress> listener : listeners) {
                listener.accept(job.progress());
            }
        }
        notifyChanged(job);
    }

    @Override
    public void onAbort(Job job) {
        if (!job.options().abortable()) {
            throw new CallException("Job " + job.id() + " is not abortable", ErrorCode.EINVAL);
        }
        if (job.state().isFinished()) {
            return;
        }

        boolean dequeued = false;
        synchronized (this) {
            if (job.state() == JobState.WAITING && job.lockName() != null) {
                LockQueue queue = lockQueues.get(job.lockName());
                dequeued = queue != null && queue.waiting.remove(job);
            }
            job.requestAbort();
        }
        if (dequeued) {
            bodies.remove(job.id());
            log.debug("waiting job aborted id={} lock={}", job.id(), job.lockName());
            complete(job, JobState.ABORTED, null, null);
            return;
        }

        if (job.options().mode() == ExecutionMode.LOOP) {
            log.debug("abort requested id={}; interrupting at next suspension point", job.id());
            job.interruptBoundThread();
        } else {
            log.debug("abort requested id={} mode={}; disowning, execution continues", job.id(), job.options().mode());
            complete(job, JobState.ABORTED, null, null);
        }
    }

    @Override
    public void subscribeProgress(Job job, Consumer<JobProgress> listener) {
        if (job.state().isFinished()) {
            return;
        }
        progressListeners.computeIfAbsent(job.id(), id -> new CopyOnWriteArrayList<>()).add(listener);
    }

    private static ForkJoinPool.ForkJoinWorkerThreadFactory loopFactory() {
        AtomicInteger counter = new AtomicInteger();
        return pool -> {
            ForkJoinWorkerThread t = ForkJoinPool.defaultForkJoinWorkerThreadFactory.newThread(pool);
            t.setName("middleware.loop-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private static ThreadFactory daemonFactory(String name) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r);
            t.setName(name + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
