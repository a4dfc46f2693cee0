package com.cmagents.ratelimit;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Admission timestamps of one key inside the trailing window, oldest first.
 * Not thread-safe; callers hold the per-key lock.
 */
final class RateWindow {

    private final String key;
    private final Deque<Long> admissions = new ArrayDeque<>();

    RateWindow(String key) {
        this.key = key;
    }

    String key() {
        return key;
    }

    void prune(long nowMillis, long windowMillis) {
        long cutoff = nowMillis - windowMillis;
        while (!admissions.isEmpty() && admissions.peekFirst() <= cutoff) {
            admissions.pollFirst();
        }
    }

    boolean tryAdmit(long nowMillis, int capacity, long windowMillis) {
        prune(nowMillis, windowMillis);
        if (admissions.size() >= capacity) {
            return false;
        }
        admissions.addLast(nowMillis);
        return true;
    }

    int size() {
        return admissions.size();
    }

    boolean isEmpty() {
        return admissions.isEmpty();
    }
}
