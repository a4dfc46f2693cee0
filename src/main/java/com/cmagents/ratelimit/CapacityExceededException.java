package com.cmagents.ratelimit;

/**
 * Synchronous rejection by an admission bound (rate limit or session capacity). Never queued.
 */
public class CapacityExceededException extends RuntimeException {

    public CapacityExceededException(String message) {
        super(message);
    }
}
