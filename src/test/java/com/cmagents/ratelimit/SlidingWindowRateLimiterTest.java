package com.cmagents.ratelimit;

import com.cmagents.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SlidingWindowRateLimiterTest {

    private final MutableClock clock = MutableClock.at("2025-03-01T10:00:00Z");
    private final SlidingWindowRateLimiter limiter =
            new SlidingWindowRateLimiter("messages", 30, Duration.ofMinutes(1), clock);

    @Test
    void admitsCapacityThenDeniesWithinWindow() {
        for (int i = 0; i < 30; i++) {
            assertTrue(limiter.check("conn-1"), "call " + (i + 1) + " should be admitted");
            clock.advance(Duration.ofSeconds(1));
        }
        assertFalse(limiter.check("conn-1"));
        assertEquals(0, limiter.remaining("conn-1"));
    }

    @Test
    void admitsAgainOnceTheFirstCallLeavesTheWindow() {
        for (int i = 0; i < 30; i++) {
            assertTrue(limiter.check("conn-1"));
        }
        clock.advance(Duration.ofSeconds(59));
        assertFalse(limiter.check("conn-1"));

        clock.advance(Duration.ofSeconds(1));
        assertTrue(limiter.check("conn-1"));
    }

    @Test
    void deniedCallsDoNotExtendTheWindow() {
        for (int i = 0; i < 30; i++) {
            limiter.check("conn-1");
        }
        clock.advance(Duration.ofSeconds(30));
        for (int i = 0; i < 10; i++) {
            assertFalse(limiter.check("conn-1"));
        }
        clock.advance(Duration.ofSeconds(30));
        assertTrue(limiter.check("conn-1"));
    }

    @Test
    void keysAreIndependent() {
        for (int i = 0; i < 30; i++) {
            limiter.check("conn-1");
        }
        assertFalse(limiter.check("conn-1"));
        assertTrue(limiter.check("conn-2"));
        assertEquals(29, limiter.remaining("conn-2"));
        assertEquals(30, limiter.remaining("never-seen"));
    }

    @Test
    void purgeIdleDropsExpiredKeysOnly() {
        limiter.check("old");
        clock.advance(Duration.ofSeconds(45));
        limiter.check("recent");
        clock.advance(Duration.ofSeconds(20));

        assertEquals(1, limiter.purgeIdle());
        assertEquals(1, limiter.trackedKeys());
        assertEquals(29, limiter.remaining("recent"));
    }

    @Test
    void resetForgetsKey() {
        for (int i = 0; i < 30; i++) {
            limiter.check("conn-1");
        }
        limiter.reset("conn-1");
        assertTrue(limiter.check("conn-1"));
    }

    @Test
    void rejectsInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class,
                () -> new SlidingWindowRateLimiter("bad", 0, Duration.ofMinutes(1), clock));
        assertThrows(IllegalArgumentException.class,
                () -> new SlidingWindowRateLimiter("bad", 5, Duration.ZERO, clock));
    }

    @Test
    void admitsExactlyCapacityUnderContentionOnOneKey() throws Exception {
        int threads = 8;
        int callsPerThread = 25;
        CountDownLatch start = new CountDownLatch(1);
        List<Callable<Integer>> callers = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            callers.add(() -> {
                start.await(5, TimeUnit.SECONDS);
                int admitted = 0;
                for (int i = 0; i < callsPerThread; i++) {
                    if (limiter.check("shared")) {
                        admitted++;
                    }
                }
                return admitted;
            });
        }

        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<Integer>> results = new ArrayList<>();
            for (Callable<Integer> caller : callers) {
                results.add(pool.submit(caller));
            }
            start.countDown();
            int admitted = 0;
            for (Future<Integer> result : results) {
                admitted += result.get(10, TimeUnit.SECONDS);
            }

            assertEquals(30, admitted);
            assertEquals(0, limiter.remaining("shared"));
            assertEquals(1, limiter.trackedKeys());
        } finally {
            pool.shutdownNow();
        }
    }
}
