package com.cmagents.orchestration.engine;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation token for one run, checked by the engine between steps.
 */
public final class RunCancellation {

    private final String runId;
    private final AtomicReference<String> reason = new AtomicReference<>();

    public RunCancellation(String runId) {
        this.runId = runId;
    }

    public String runId() {
        return runId;
    }

    /**
     * @return {@code true} if this call cancelled the run, {@code false} if it was already cancelled
     */
    public boolean cancel(String why) {
        return reason.compareAndSet(null, why == null ? "cancelled" : why);
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public String reason() {
        String value = reason.get();
        return value == null ? "" : value;
    }
}
