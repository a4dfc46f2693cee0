package com.cmagents.orchestration.model;

import com.cmagents.artifact.ArtifactReference;
import org.springframework.lang.Nullable;

import java.time.Duration;

public record RunResult(
        String runId,
        ContentRequest request,
        WorkerPlan plan,
        OrchestrationTrace trace,
        RunStatus status,
        @Nullable ArtifactReference artifact,
        double totalCostUsd,
        Duration duration,
        @Nullable InputTranslation translation
) {

    public RunResult withArtifact(@Nullable ArtifactReference reference) {
        return new RunResult(runId, request, plan, trace, status, reference, totalCostUsd, duration, translation);
    }

    public long generatedCount() {
        return trace.count(WorkerName.GENERATE, OutcomeStatus.SUCCEEDED);
    }

    public long errorCount() {
        return trace.failures();
    }
}
