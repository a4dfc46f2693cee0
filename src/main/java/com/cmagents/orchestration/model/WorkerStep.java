package com.cmagents.orchestration.model;

import java.util.Objects;

public record WorkerStep(
        WorkerName name,
        boolean willRun,
        String reason,
        int order
) {

    public WorkerStep {
        Objects.requireNonNull(name, "name");
        reason = reason == null ? "" : reason;
        if (order != name.order()) {
            throw new IllegalArgumentException("Step " + name.key() + " must have order " + name.order());
        }
    }

    public static WorkerStep of(WorkerName name, boolean willRun, String reason) {
        return new WorkerStep(name, willRun, reason, name.order());
    }
}
