package io.middleware4j.service;

import io.middleware4j.job.Job;

import java.util.List;

/**
 * Implementation of one service method. {@code job} is the running job for job-backed methods and null otherwise.
 */
@FunctionalInterface
public interface ServiceMethod {

    Object invoke(Job job, List<Object> args) throws Exception;
}
