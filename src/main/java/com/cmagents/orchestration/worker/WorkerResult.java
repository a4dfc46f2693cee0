package com.cmagents.orchestration.worker;

import org.springframework.lang.Nullable;

import java.util.List;

public record WorkerResult(boolean success, @Nullable Object payload, List<String> feedback, double costUsd) {

    public WorkerResult {
        feedback = feedback == null ? List.of() : List.copyOf(feedback);
    }

    public static WorkerResult ok(@Nullable Object payload) {
        return new WorkerResult(true, payload, List.of(), 0.0);
    }

    public static WorkerResult ok(@Nullable Object payload, double costUsd) {
        return new WorkerResult(true, payload, List.of(), costUsd);
    }

    public static WorkerResult rejected(@Nullable Object payload, List<String> feedback) {
        return new WorkerResult(false, payload, feedback, 0.0);
    }
}
