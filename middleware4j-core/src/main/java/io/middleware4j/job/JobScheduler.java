package io.middleware4j.job;

import io.middleware4j.JobBody;
import io.middleware4j.core.Filter;
import io.middleware4j.core.QueryOptions;
import io.middleware4j.core.QueryResult;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Admits, tracks and runs jobs.
 *
 * <p>Jobs that declare a lock run one at a time per lock name, in submission order. A lock may bound its wait
 * queue; when it is full, {@link #submit} creates nothing and returns the job currently at the tail of the queue.
 */
public interface JobScheduler {

    void start();

    void stop();

    /**
     * Admit a job. Returns the new job, or the coalesced tail job when the lock's wait queue is full.
     *
     * @param body job body; may be null for PROCESS mode, where the declared process body runs instead
     */
    Job submit(String method, List<Object> arguments, JobOptions options, JobBody body, Pipes pipes);

    default Job submit(String method, List<Object> arguments, JobOptions options, JobBody body) {
        return submit(method, arguments, options, body, Pipes.none());
    }

    Optional<Job> get(long id);

    /**
     * Jobs in the visible table, oldest first. Finished transient jobs are never listed.
     */
    List<Job> all();

    /**
     * Filterable view over encoded jobs, as served by {@code core.get_jobs}.
     */
    QueryResult query(List<Filter> filters, QueryOptions options);

    /**
     * Abort an abortable job. Waiting jobs are dropped from their queue; loop-mode jobs are interrupted at their
     * next suspension point; thread and process jobs are disowned while their execution runs to completion.
     */
    void abort(long id);

    /**
     * Remove finished jobs that ended more than {@code olderThan} ago. Returns the number removed.
     */
    int reap(Duration olderThan);
}
