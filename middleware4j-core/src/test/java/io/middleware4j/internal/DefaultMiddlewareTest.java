package io.middleware4j.internal;

import io.middleware4j.MiddlewareHarness;
import io.middleware4j.core.ExecutionMode;
import io.middleware4j.core.JobState;
import io.middleware4j.errors.CallException;
import io.middleware4j.errors.ErrorCode;
import io.middleware4j.errors.ValidationException;
import io.middleware4j.job.Job;
import io.middleware4j.job.JobOptions;
import io.middleware4j.job.Pipes;
import io.middleware4j.service.CoreService;
import io.middleware4j.service.MethodDescriptor;
import io.middleware4j.service.Service;
import io.middleware4j.service.ServiceDescriptor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static io.middleware4j.MiddlewareHarness.waitUntil;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultMiddlewareTest {

    private final AtomicInteger running = new AtomicInteger();
    private final AtomicInteger maxRunning = new AtomicInteger();
    private final AtomicInteger ticks = new AtomicInteger();
    private final AtomicInteger lateTicks = new AtomicInteger();
    private final CountDownLatch slowRelease = new CountDownLatch(1);

    private MiddlewareHarness harness;

    private final class PoolService extends Service {
        PoolService() {
            super(ServiceDescriptor.builder("pool").build());
        }

        @Override
        public List<MethodDescriptor> methods() {
            return List.of(
                    MethodDescriptor.builder("echo", (job, args) -> {
                        if ("bad".equals(args.get(0))) {
                            throw new ValidationException("pool.echo", "bad value");
                        }
                        return args.get(0);
                    }).build(),
                    MethodDescriptor.builder("secret", (job, args) -> "hidden").privateMethod(true).build(),
                    MethodDescriptor.builder("broken", (job, args) -> {
                        throw new IOException("disk unreadable");
                    }).build(),
                    MethodDescriptor.builder("scrub", (job, args) -> {
                        slowRelease.await(5, TimeUnit.SECONDS);
                        job.setProgress(100, "done");
                        return "scrubbed " + args.get(0);
                    }).job(JobOptions.builder().mode(ExecutionMode.THREAD).abortable(true).build()).build(),
                    MethodDescriptor.builder("quick", (job, args) -> "quick " + args.get(0))
                            .job(JobOptions.builder().mode(ExecutionMode.THREAD).build()).build(),
                    MethodDescriptor.builder("sync_blocking", (job, args) -> guarded())
                            .lock("pool.sync.blocking").threadPool(true).build(),
                    MethodDescriptor.builder("sync_cooperative", (job, args) -> guarded())
                            .lock("pool.sync.cooperative").build(),
                    MethodDescriptor.builder("whereami", (job, args) -> Thread.currentThread().getName())
                            .lock("pool.whereami").threadPool(true).build(),
                    MethodDescriptor.builder("tick", (job, args) -> ticks.incrementAndGet())
                            .periodic(Duration.ofMillis(50), true).build(),
                    MethodDescriptor.builder("late_tick", (job, args) -> lateTicks.incrementAndGet())
                            .periodic(Duration.ofHours(1), false).build()
            );
        }

        private Object guarded() throws InterruptedException {
            maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
            Thread.sleep(20);
            running.decrementAndGet();
            return null;
        }
    }

    @BeforeEach
    void setUp() {
        harness = new MiddlewareHarness(new PoolService(), new CoreService());
    }

    @AfterEach
    void tearDown() {
        slowRelease.countDown();
        harness.close();
    }

    @Test
    void plainMethodShouldReturnItsResult() {
        assertEquals("x", harness.middleware.call("pool.echo", "x"));
        assertEquals("pong", harness.middleware.call("core.ping"));
    }

    @Test
    void unknownMethodShouldRaiseNoMethod() {
        CallException e = assertThrows(CallException.class, () -> harness.middleware.call("pool.nope"));
        assertEquals(ErrorCode.ENOMETHOD, e.code());
    }

    @Test
    void privateMethodShouldBeHiddenFromExternalCallers() {
        assertEquals("hidden", harness.middleware.call("pool.secret"));

        CallException e = assertThrows(CallException.class,
                () -> harness.middleware.callExternal("pool.secret", List.of()));
        assertEquals(ErrorCode.ENOMETHOD, e.code());
        assertEquals("x", harness.middleware.callExternal("pool.echo", List.of("x")));
    }

    @Test
    void checkedFailureShouldBecomeCallException() {
        CallException e = assertThrows(CallException.class, () -> harness.middleware.call("pool.broken"));

        assertEquals(ErrorCode.EFAULT, e.code());
        assertInstanceOf(IOException.class, e.getCause());
    }

    @Test
    void jobMethodShouldReturnJob() throws Exception {
        Object result = harness.middleware.call("pool.quick", "tank");

        Job job = assertInstanceOf(Job.class, result);
        assertEquals("pool.quick", job.method());
        assertEquals("quick tank", job.await(Duration.ofSeconds(5)));
    }

    @Test
    void callJobShouldRejectPlainMethods() {
        CallException e = assertThrows(CallException.class,
                () -> harness.middleware.callJob("pool.echo", List.of("x"), Pipes.none()));
        assertEquals(ErrorCode.EINVAL, e.code());
    }

    @Test
    void blockingMethodLockShouldSerializeCallers() throws Exception {
        assertSerialized("pool.sync_blocking");
    }

    @Test
    void cooperativeMethodLockShouldSerializeCallers() throws Exception {
        assertSerialized("pool.sync_cooperative");
    }

    @Test
    void threadPoolMethodShouldRunOnCallerThread() throws Exception {
        assertEquals(Thread.currentThread().getName(), harness.middleware.call("pool.whereami"));

        List<Object> seen = new ArrayList<>();
        Thread recorder = new Thread(() -> seen.add(harness.middleware.call("pool.whereami")), "external-caller");
        recorder.start();
        recorder.join(5000);

        assertEquals(List.of("external-caller"), seen);
    }

    private void assertSerialized(String method) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> calls = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                calls.add(pool.submit(() -> harness.middleware.call(method)));
            }
            for (Future<?> call : calls) {
                call.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, maxRunning.get());
    }

    @Test
    void periodicMethodsShouldRunOnSchedule() throws Exception {
        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> ticks.get() >= 3));
        assertEquals(0, lateTicks.get());
    }

    @Test
    void getJobsShouldFilterEncodedJobs() throws Exception {
        Job quick = (Job) harness.middleware.call("pool.quick", "a");
        quick.await(Duration.ofSeconds(5));
        Job scrub = (Job) harness.middleware.call("pool.scrub", "tank");

        List<?> rows = (List<?>) harness.middleware.call("core.get_jobs",
                List.of(List.of("method", "=", "pool.scrub")), Map.of());
        Object single = harness.middleware.call("core.get_jobs",
                List.of(List.of("id", "=", quick.id())), Map.of("get", true));

        assertEquals(1, rows.size());
        assertEquals(scrub.id(), ((Map<?, ?>) rows.get(0)).get("id"));
        assertEquals("SUCCESS", ((Map<?, ?>) single).get("state"));
    }

    @Test
    void jobUpdateAndAbortShouldReachTheJob() throws Exception {
        Job scrub = (Job) harness.middleware.call("pool.scrub", "tank");

        harness.middleware.call("core.job_update", scrub.id(),
                Map.of("progress", Map.of("percent", 30, "description", "reading")));
        assertEquals(30.0, scrub.progress().percent());
        assertEquals("reading", scrub.progress().description());

        harness.middleware.call("core.job_abort", scrub.id());
        assertEquals(JobState.ABORTED, scrub.state());
    }

    @Test
    void jobWaitShouldMirrorAndReturnWaitedResult() throws Exception {
        Job scrub = (Job) harness.middleware.call("pool.scrub", "tank");
        Job waiter = (Job) harness.middleware.call("core.job_wait", scrub.id());

        slowRelease.countDown();

        assertEquals("scrubbed tank", waiter.await(Duration.ofSeconds(5)));
        assertEquals("done", waiter.progress().description());
    }

    @Test
    void bulkShouldCollectStatusesAndNeverFail() throws Exception {
        Job bulk = (Job) harness.middleware.call("core.bulk", "pool.echo", List.of(List.of(1), List.of("bad"), 3));

        @SuppressWarnings("unchecked")
        List<Map<String, Object>> statuses = (List<Map<String, Object>>) bulk.await(Duration.ofSeconds(5));

        assertEquals(JobState.SUCCESS, bulk.state());
        assertEquals(3, statuses.size());
        assertEquals(1, statuses.get(0).get("result"));
        assertNull(statuses.get(0).get("error"));
        assertTrue(String.valueOf(statuses.get(1).get("error")).contains("bad value"));
        assertEquals(3, statuses.get(2).get("result"));
        assertEquals("Bulk call of pool.echo", bulk.description());
        assertEquals(100.0, bulk.progress().percent());
    }

    @Test
    void bulkOfJobMethodShouldAwaitEachJob() throws Exception {
        Job bulk = (Job) harness.middleware.call("core.bulk", "pool.quick", List.of(List.of("a"), List.of("b")));

        @SuppressWarnings("unchecked")
        List<Map<String, Object>> statuses = (List<Map<String, Object>>) bulk.await(Duration.ofSeconds(5));

        assertEquals("quick a", statuses.get(0).get("result"));
        assertNotNull(statuses.get(0).get("job_id"));
        assertEquals("quick b", statuses.get(1).get("result"));
    }

    @Test
    void introspectionShouldDescribeServicesAndMethods() {
        @SuppressWarnings("unchecked")
        Map<String, Map<String, Object>> methods =
                (Map<String, Map<String, Object>>) harness.middleware.call("core.get_methods", "pool");
        @SuppressWarnings("unchecked")
        Map<String, Map<String, Object>> services =
                (Map<String, Map<String, Object>>) harness.middleware.call("core.get_services");

        assertEquals(true, methods.get("pool.secret").get("private"));
        assertEquals(true, methods.get("pool.scrub").get("job"));
        assertEquals(true, methods.get("pool.scrub").get("abortable"));
        assertTrue(methods.keySet().stream().allMatch(name -> name.startsWith("pool.")));
        assertEquals("service", services.get("pool").get("type"));
    }

    @Test
    void callHookShouldRunRegisteredListeners() {
        List<Object> seen = new ArrayList<>();
        harness.hooks.register("pool.post_import", args -> seen.addAll(args));

        Object ran = harness.middleware.call("core.call_hook", "pool.post_import", "tank");

        assertEquals(1, ran);
        assertEquals(List.of("tank"), seen);
    }

    @Test
    void serviceLookupShouldCheckType() {
        assertInstanceOf(CoreService.class, harness.middleware.service("core", CoreService.class));
        assertThrows(IllegalArgumentException.class,
                () -> harness.middleware.service("pool", CoreService.class));
    }
}
