package io.middleware4j.job.process;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.middleware4j.config.MiddlewareProperties;
import io.middleware4j.core.ExecutionMode;
import io.middleware4j.core.JobState;
import io.middleware4j.errors.CallException;
import io.middleware4j.event.EventHub;
import io.middleware4j.job.DefaultJobScheduler;
import io.middleware4j.job.Job;
import io.middleware4j.job.JobOptions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProcessJobRunnerTest {

    public static class SumBody implements ProcessJobBody {
        @Override
        public Object run(ProcessJobContext context, List<Object> arguments) {
            context.setProgress(50, "adding");
            int sum = 0;
            for (Object a : arguments) {
                sum += ((Number) a).intValue();
            }
            return Map.of("sum", sum);
        }
    }

    public static class FailingBody implements ProcessJobBody {
        @Override
        public Object run(ProcessJobContext context, List<Object> arguments) {
            throw new IllegalStateException("disk is gone");
        }
    }

    public static class ChattyBody implements ProcessJobBody {
        @Override
        public Object run(ProcessJobContext context, List<Object> arguments) {
            context.log("first line");
            System.out.println("second line");
            return null;
        }
    }

    @TempDir
    Path logsDir;

    private DefaultJobScheduler scheduler;

    @BeforeEach
    void setUp() {
        MiddlewareProperties props = new MiddlewareProperties();
        props.setProcessPoolSize(2);
        props.setJobLogsDir(logsDir);
        props.setShutdownTimeout(Duration.ofSeconds(5));
        scheduler = new DefaultJobScheduler(props, new EventHub(), new ObjectMapper());
        scheduler.start();
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
    }

    @Test
    void childResultAndProgressShouldReachParentJob() throws Exception {
        Job job = scheduler.submit("math.sum", List.of(1, 2, 3),
                JobOptions.builder().process(SumBody.class).build(), null);

        Object result = job.await(Duration.ofSeconds(60));

        assertEquals(Map.of("sum", 6), result);
        assertEquals(JobState.SUCCESS, job.state());
        assertEquals(50.0, job.progress().percent());
        assertEquals("adding", job.progress().description());
    }

    @Test
    void childFailureShouldFailJobWithRemoteType() throws Exception {
        Job job = scheduler.submit("disk.probe", List.of(),
                JobOptions.builder().process(FailingBody.class).build(), null);

        CallException e = assertThrows(CallException.class, () -> job.await(Duration.ofSeconds(60)));

        assertEquals("disk is gone", e.getMessage());
        assertEquals("IllegalStateException", e.extra().get("type"));
        assertEquals(JobState.FAILED, job.state());
    }

    @Test
    void plainChildOutputShouldLandInJobLog() throws Exception {
        Job job = scheduler.submit("disk.probe", List.of(),
                JobOptions.builder().process(ChattyBody.class).logs(true).build(), null);

        job.await(Duration.ofSeconds(60));

        String log = Files.readString(job.logsPath());
        assertTrue(log.contains("first line"));
        assertTrue(log.contains("second line"));
        assertEquals(ExecutionMode.PROCESS, job.options().mode());
    }
}
