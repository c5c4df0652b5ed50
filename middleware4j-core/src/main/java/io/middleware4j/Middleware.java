package io.middleware4j;

import io.middleware4j.datastore.Datastore;
import io.middleware4j.event.EventHub;
import io.middleware4j.job.Job;
import io.middleware4j.job.JobScheduler;
import io.middleware4j.job.Pipes;
import io.middleware4j.service.HookRegistry;
import io.middleware4j.service.Service;
import io.middleware4j.service.ServiceRegistry;

import java.util.List;

/**
 * Dispatches named operations ({@code <namespace>.<method>}) to registered services.
 *
 * <p>Typical usage:
 * <pre>{@code
 * middleware.start();
 *
 * Map<String, Object> cfg = (Map<String, Object>) middleware.call("smb.config");
 * Job job = (Job) middleware.call("pool.scrub.run", "tank");
 * job.await();
 *
 * middleware.stop();
 * }</pre>
 */
public interface Middleware {

    /**
     * Start the job scheduler and periodic methods. Should be idempotent.
     */
    void start();

    /**
     * Stop periodic methods and the job scheduler. Should be idempotent.
     */
    void stop();

    /**
     * Internal call. Private methods are allowed. Job-backed methods return their {@link Job}.
     */
    Object call(String method, Object... args);

    Object callArgs(String method, List<Object> args);

    /**
     * Submit a job-backed method with its pipes attached.
     */
    Job callJob(String method, List<Object> args, Pipes pipes);

    /**
     * Call on behalf of an external client: private methods and private services are not reachable.
     */
    Object callExternal(String method, List<Object> args);

    <T extends Service> T service(String namespace, Class<T> type);

    ServiceRegistry services();

    JobScheduler jobs();

    EventHub events();

    HookRegistry hooks();

    Datastore datastore();
}
