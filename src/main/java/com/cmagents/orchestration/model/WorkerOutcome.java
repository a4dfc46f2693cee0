package com.cmagents.orchestration.model;

import org.springframework.lang.Nullable;

import java.time.Instant;

public record WorkerOutcome(
        WorkerName step,
        OutcomeStatus status,
        @Nullable Object payload,
        @Nullable ErrorKind errorKind,
        String message,
        int attempt,
        double costUsd,
        Instant timestamp
) {

    public WorkerOutcome {
        message = message == null ? "" : message;
    }

    public boolean success() {
        return status == OutcomeStatus.SUCCEEDED;
    }

    public static WorkerOutcome succeeded(WorkerName step, @Nullable Object payload, String message,
                                          int attempt, double costUsd, Instant at) {
        return new WorkerOutcome(step, OutcomeStatus.SUCCEEDED, payload, null, message, attempt, costUsd, at);
    }

    public static WorkerOutcome rejected(WorkerName step, @Nullable Object payload, String feedback,
                                         int attempt, double costUsd, Instant at) {
        return new WorkerOutcome(step, OutcomeStatus.REJECTED, payload, null, feedback, attempt, costUsd, at);
    }

    public static WorkerOutcome failed(WorkerName step, ErrorKind kind, String message, int attempt, Instant at) {
        return new WorkerOutcome(step, OutcomeStatus.FAILED, null, kind, message, attempt, 0.0, at);
    }

    public static WorkerOutcome skipped(WorkerName step, String reason, Instant at) {
        return new WorkerOutcome(step, OutcomeStatus.SKIPPED, null, null, reason, 0, 0.0, at);
    }

    public static WorkerOutcome cancelled(WorkerName step, int attempt, Instant at) {
        return new WorkerOutcome(step, OutcomeStatus.CANCELLED, null, ErrorKind.CANCELLED,
                "Run cancelled before " + step.key() + ".", attempt, 0.0, at);
    }
}
