package com.cmagents.api;

import com.cmagents.artifact.ArtifactDocument;
import com.cmagents.orchestration.model.InputTranslation;
import com.cmagents.orchestration.model.RunResult;

import java.util.List;

public record RunResponse(
        String runId,
        String status,
        ArtifactDocument.Plan workerPlan,
        List<ArtifactDocument.TraceEntry> trace,
        long generated,
        long errors,
        double costUsd,
        long durationMs,
        String artifactDirectory,
        InputTranslation inputTranslation
) {

    public static RunResponse from(RunResult result) {
        return new RunResponse(
                result.runId(),
                result.status().name(),
                ArtifactDocument.Plan.of(result.plan()),
                result.trace().entries().stream().map(ArtifactDocument.TraceEntry::of).toList(),
                result.generatedCount(),
                result.errorCount(),
                result.totalCostUsd(),
                result.duration().toMillis(),
                result.artifact() != null ? result.artifact().directory() : null,
                result.translation()
        );
    }
}
