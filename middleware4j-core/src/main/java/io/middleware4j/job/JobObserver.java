package io.middleware4j.job;

import io.middleware4j.core.JobProgress;

import java.util.function.Consumer;

/**
 * Scheduler callbacks for changes made from inside a job body.
 */
interface JobObserver {

    void onChanged(Job job);

    void onAbort(Job job);

    void subscribeProgress(Job job, Consumer<JobProgress> listener);
}
