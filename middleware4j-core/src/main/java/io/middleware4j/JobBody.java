package io.middleware4j;

import io.middleware4j.job.Job;

/**
 * Body of a job-backed method. Runs once the scheduler admits the job; may report progress through the job.
 */
@FunctionalInterface
public interface JobBody {
    Object run(Job job) throws Exception;
}
