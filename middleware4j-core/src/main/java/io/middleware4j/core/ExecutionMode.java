package io.middleware4j.core;

/**
 * Where a job body runs.
 *
 * <ul>
 *   <li>LOOP: inline on the single cooperative scheduler thread; the only mode that can be aborted mid-flight</li>
 *   <li>THREAD: on the bounded worker-thread pool</li>
 *   <li>PROCESS: in an isolated child JVM</li>
 * </ul>
 */
public enum ExecutionMode {
    LOOP,
    THREAD,
    PROCESS
}
