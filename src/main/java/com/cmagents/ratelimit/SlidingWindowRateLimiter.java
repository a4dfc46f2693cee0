package com.cmagents.ratelimit;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Sliding-window admission counter keyed by caller identity.
 * <p>
 * Every check prunes timestamps older than the window and admits only while the
 * remaining count is below capacity. Each key is guarded by its own map bin, so
 * unrelated keys never contend. The limiter never throws; a denied call leaves
 * no trace in the window.
 */
@Slf4j
public class SlidingWindowRateLimiter {

    private final String name;
    private final int capacity;
    private final long windowMillis;
    private final Clock clock;
    private final Map<String, RateWindow> windows = new ConcurrentHashMap<>();

    public SlidingWindowRateLimiter(String name, int capacity, Duration window, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Rate limiter capacity must be positive: " + capacity);
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("Rate limiter window must be positive.");
        }
        this.name = name;
        this.capacity = capacity;
        this.windowMillis = window.toMillis();
        this.clock = clock;
    }

    /**
     * Records an admission for {@code key} if the trailing window still has room.
     *
     * @return {@code true} when admitted, {@code false} when the key is at capacity
     */
    public boolean check(String key) {
        long now = clock.millis();
        boolean[] admitted = new boolean[1];
        windows.compute(key, (k, window) -> {
            RateWindow target = window != null ? window : new RateWindow(k);
            admitted[0] = target.tryAdmit(now, capacity, windowMillis);
            return target;
        });
        if (!admitted[0]) {
            log.debug("Rate limiter {} denied {}", name, key);
        }
        return admitted[0];
    }

    int remaining(String key) {
        long now = clock.millis();
        RateWindow window = windows.computeIfPresent(key, (k, current) -> {
            current.prune(now, windowMillis);
            return current;
        });
        return window == null ? capacity : Math.max(0, capacity - window.size());
    }

    public void reset(String key) {
        windows.remove(key);
    }

    /**
     * Drops windows that hold no admission inside the trailing window.
     *
     * @return number of keys removed
     */
    public int purgeIdle() {
        long now = clock.millis();
        AtomicInteger purged = new AtomicInteger();
        for (String key : windows.keySet()) {
            windows.computeIfPresent(key, (k, window) -> {
                window.prune(now, windowMillis);
                if (window.isEmpty()) {
                    purged.incrementAndGet();
                    return null;
                }
                return window;
            });
        }
        if (purged.get() > 0) {
            log.debug("Rate limiter {} purged {} idle keys", name, purged.get());
        }
        return purged.get();
    }

    int trackedKeys() {
        return windows.size();
    }
}
