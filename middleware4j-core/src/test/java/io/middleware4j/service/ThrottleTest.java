package io.middleware4j.service;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ThrottleTest {

    private final AtomicLong now = new AtomicLong(1_000_000_000L);

    @Test
    void secondCallWithinPeriodShouldWaitForSlot() throws Exception {
        Throttle throttle = new Throttle(Duration.ofSeconds(10), null, now::get);
        throttle.await(List.of());

        CompletableFuture<Void> second = CompletableFuture.runAsync(() -> {
            try {
                throttle.await(List.of());
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });
        Thread.sleep(200);
        assertFalse(second.isDone());

        now.addAndGet(Duration.ofSeconds(11).toNanos());
        second.get(3, TimeUnit.SECONDS);
    }

    @Test
    void keysShouldBeThrottledIndependently() throws Exception {
        Throttle throttle = new Throttle(Duration.ofSeconds(10),
                args -> new Throttle.Decision(false, args.get(0)), now::get);

        throttle.await(List.of("a"));
        throttle.await(List.of("b"));

        CompletableFuture<Void> again = CompletableFuture.runAsync(() -> {
            try {
                throttle.await(List.of("a"));
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });
        Thread.sleep(200);
        assertFalse(again.isDone());
        now.addAndGet(Duration.ofSeconds(11).toNanos());
        again.get(3, TimeUnit.SECONDS);
    }

    @Test
    void bypassShouldSkipThrottling() throws Exception {
        Throttle throttle = new Throttle(Duration.ofHours(1),
                args -> new Throttle.Decision("urgent".equals(args.get(0)), null), now::get);

        throttle.await(List.of("normal"));
        for (int i = 0; i < 3; i++) {
            throttle.await(List.of("urgent"));
        }
    }

    @Test
    void wrappedMethodShouldRunAfterThrottle() throws Exception {
        Throttle throttle = new Throttle(Duration.ZERO, null, now::get);
        ServiceMethod method = throttle.wrap((job, args) -> "ran " + args.get(0));

        assertEquals("ran 1", method.invoke(null, List.of(1)));
        now.incrementAndGet();
        assertEquals("ran 2", method.invoke(null, List.of(2)));
    }

    @Test
    void negativePeriodShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> new Throttle(Duration.ofSeconds(-1)));
    }
}
