package io.middleware4j.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.middleware4j.JobBody;
import io.middleware4j.Middleware;
import io.middleware4j.config.MiddlewareProperties;
import io.middleware4j.core.ExecutionMode;
import io.middleware4j.core.ServiceType;
import io.middleware4j.datastore.Datastore;
import io.middleware4j.errors.CallException;
import io.middleware4j.errors.ErrorCode;
import io.middleware4j.errors.MiddlewareException;
import io.middleware4j.event.EventHub;
import io.middleware4j.job.DefaultJobScheduler;
import io.middleware4j.job.Job;
import io.middleware4j.job.JobOptions;
import io.middleware4j.job.JobScheduler;
import io.middleware4j.job.Pipes;
import io.middleware4j.lock.LockHandle;
import io.middleware4j.lock.Locks;
import io.middleware4j.service.CompoundService;
import io.middleware4j.service.HookRegistry;
import io.middleware4j.service.Service;
import io.middleware4j.service.ServiceContext;
import io.middleware4j.service.ServiceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Default {@link Middleware}: resolves {@code <namespace>.<method>} through the {@link ServiceRegistry}, submits
 * job-backed methods to the {@link JobScheduler} and runs plain methods on the caller's thread.
 */
public class DefaultMiddleware implements Middleware {
    private static final Logger log = LoggerFactory.getLogger(DefaultMiddleware.class);

    private final MiddlewareProperties props;
    private final ServiceRegistry registry;
    private final JobScheduler jobs;
    private final EventHub events;
    private final HookRegistry hooks;
    private final Datastore datastore;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private ScheduledExecutorService periodicPool;

    public DefaultMiddleware(MiddlewareProperties props, ServiceRegistry registry, JobScheduler jobs, EventHub events,
                             HookRegistry hooks, Datastore datastore, ObjectMapper objectMapper) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.jobs = Objects.requireNonNull(jobs, "jobs must not be null");
        this.events = Objects.requireNonNull(events, "events must not be null");
        this.hooks = Objects.requireNonNull(hooks, "hooks must not be null");
        this.datastore = Objects.requireNonNull(datastore, "datastore must not be null");
        Objects.requireNonNull(objectMapper, "objectMapper must not be null");

        registry.bindAll(new ServiceContext(this, datastore, hooks, events, registry, objectMapper));
        events.register(DefaultJobScheduler.JOBS_EVENT, "Updates on job changes.");
        for (Service service : registry.all()) {
            if (service.type() == ServiceType.CRUD && service.descriptor().eventRegister()) {
                events.register(service.namespace() + ".query",
                        "Sent on " + service.descriptor().verboseName() + " changes.");
            }
        }
    }

    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        log.info("Middleware starting with services={}, methods={}",
                registry.all().size(), registry.methods().size());

        Locks.COOPERATIVE.setWarnThreshold(props.getLockRegistryWarnThreshold());
        Locks.BLOCKING.setWarnThreshold(props.getLockRegistryWarnThreshold());
        jobs.start();
        registry.dependencies(datastore);

        List<ServiceRegistry.ResolvedMethod> periodic = new ArrayList<>();
        for (ServiceRegistry.ResolvedMethod m : registry.methods()) {
            if (m.method().isPeriodic()) {
                periodic.add(m);
            }
        }
        if (!periodic.isEmpty()) {
            AtomicInteger counter = new AtomicInteger();
            periodicPool = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r);
                t.setName("middleware.periodic-" + counter.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
            for (ServiceRegistry.ResolvedMethod m : periodic) {
                long interval = m.method().periodicInterval().toMillis();
                long delay = m.method().periodicRunOnStart() ? 0 : interval;
                periodicPool.scheduleWithFixedDelay(() -> runPeriodic(m), delay, interval, TimeUnit.MILLISECONDS);
                log.info("Periodic method scheduled method={} interval={} runOnStart={}",
                        m.fullName(), m.method().periodicInterval(), m.method().periodicRunOnStart());
            }
        }
        log.info("Middleware started successfully.");
    }

    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        log.info("Middleware stopping...");
        if (periodicPool != null) {
            periodicPool.shutdownNow();
            try {
                if (!periodicPool.awaitTermination(props.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Periodic methods did not stop within {}", props.getShutdownTimeout());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                periodicPool = null;
            }
        }
        jobs.stop();
        log.info("Middleware stopped successfully.");
    }

    private void runPeriodic(ServiceRegistry.ResolvedMethod m) {
        try {
            Object result = dispatch(m, List.of(), Pipes.none());
            if (result instanceof Job job) {
                job.await();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (MiddlewareException e) {
            if (e.isExpected()) {
                log.debug("periodic method failed method={} code={} msg={}", m.fullName(), e.code(), e.getMessage());
            } else {
                log.error("periodic method failed method={} msg={}", m.fullName(), e.getMessage(), e);
            }
        } catch (RuntimeException e) {
            log.error("periodic method failed method={} msg={}", m.fullName(), e.getMessage(), e);
        }
    }

    @Override
    public Object call(String method, Object... args) {
        return callArgs(method, args == null ? List.of() : new ArrayList<>(Arrays.asList(args)));
    }

    @Override
    public Object callArgs(String method, List<Object> args) {
        return dispatch(registry.resolve(method), args == null ? List.of() : args, Pipes.none());
    }

    @Override
    public Job callJob(String method, List<Object> args, Pipes pipes) {
        ServiceRegistry.ResolvedMethod m = registry.resolve(method);
        if (!m.method().isJob()) {
            throw new CallException(method + " is not a job method", ErrorCode.EINVAL);
        }
        return (Job) dispatch(m, args == null ? List.of() : args, pipes);
    }

    @Override
    public Object callExternal(String method, List<Object> args) {
        ServiceRegistry.ResolvedMethod m = registry.resolve(method);
        if (m.isPrivate()) {
            throw new CallException("Method " + method + " not found", ErrorCode.ENOMETHOD);
        }
        try {
            return dispatch(m, args == null ? List.of() : args, Pipes.none());
        } catch (MiddlewareException e) {
            if (!e.isExpected()) {
                log.error("call failed method={} msg={}", method, e.getMessage(), e);
            }
            throw e;
        } catch (RuntimeException e) {
            log.error("call failed method={} msg={}", method, e.getMessage(), e);
            throw e;
        }
    }

    private Object dispatch(ServiceRegistry.ResolvedMethod m, List<Object> args, Pipes pipes) {
        if (m.method().isJob()) {
            JobOptions options = m.method().job();
            JobBody body = options.mode() == ExecutionMode.PROCESS
                    ? null
                    : job -> m.method().handler().invoke(job, args);
            return jobs.submit(m.fullName(), args, options, body, pipes);
        }

        String lock = m.method().lock();
        if (lock == null) {
            return invoke(m, args);
        }
        // threadPool picks the lock flavor only; the body still runs on this thread
        if (m.method().threadPool()) {
            try (LockHandle ignored = Locks.BLOCKING.acquireInterruptibly(lock)) {
                return invoke(m, args);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CallException(m.fullName() + " interrupted waiting for lock " + lock, ErrorCode.EFAULT, e);
            }
        }
        try (LockHandle ignored = Locks.COOPERATIVE.acquire(lock).get()) {
            return invoke(m, args);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CallException(m.fullName() + " interrupted waiting for lock " + lock, ErrorCode.EFAULT, e);
        } catch (ExecutionException e) {
            throw new CallException(m.fullName() + " failed to acquire lock " + lock, ErrorCode.EFAULT, e.getCause());
        }
    }

    private Object invoke(ServiceRegistry.ResolvedMethod m, List<Object> args) {
        try {
            return m.method().handler().invoke(null, args);
        } catch (RuntimeException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CallException(m.fullName() + " was interrupted", ErrorCode.EFAULT, e);
        } catch (Exception e) {
            throw new CallException(String.valueOf(e.getMessage()), ErrorCode.EFAULT, e);
        }
    }

    @Override
    public <T extends Service> T service(String namespace, Class<T> type) {
        Service service = registry.getRequired(namespace);
        if (type.isInstance(service)) {
            return type.cast(service);
        }
        if (service instanceof CompoundService compound) {
            for (Service part : compound.parts()) {
                if (type.isInstance(part)) {
                    return type.cast(part);
                }
            }
        }
        throw new IllegalArgumentException(namespace + " is not a " + type.getSimpleName());
    }

    @Override
    public ServiceRegistry services() {
        return registry;
    }

    @Override
    public JobScheduler jobs() {
        return jobs;
    }

    @Override
    public EventHub events() {
        return events;
    }

    @Override
    public HookRegistry hooks() {
        return hooks;
    }

    @Override
    public Datastore datastore() {
        return datastore;
    }
}
