package io.middleware4j.job.process;

import java.util.List;

/**
 * Body of a PROCESS-mode job. Runs inside a child JVM, so implementations need a public no-arg constructor and
 * must only rely on what is on the application classpath. Arguments and the result cross the process boundary
 * as JSON.
 */
@FunctionalInterface
public interface ProcessJobBody {

    Object run(ProcessJobContext context, List<Object> arguments) throws Exception;
}
