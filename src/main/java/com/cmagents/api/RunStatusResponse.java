package com.cmagents.api;

import com.cmagents.entity.CampaignRun;

import java.time.OffsetDateTime;
import java.util.Arrays;
import java.util.List;

public record RunStatusResponse(
        String runId,
        String brandId,
        String campaignId,
        String objective,
        String planMode,
        List<String> workerSequence,
        String status,
        boolean active,
        String artifactPath,
        Double costUsd,
        Long durationMs,
        Long generated,
        Long errors,
        String errorMessage,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static RunStatusResponse from(CampaignRun run, boolean active) {
        List<String> sequence = run.getWorkerSequence() == null || run.getWorkerSequence().isBlank()
                ? List.of()
                : Arrays.asList(run.getWorkerSequence().split(","));
        return new RunStatusResponse(
                run.getRunId(),
                run.getBrandId(),
                run.getCampaignId(),
                run.getObjective(),
                run.getPlanMode(),
                sequence,
                run.getStatus(),
                active,
                run.getArtifactPath(),
                run.getCostUsd(),
                run.getDurationMs(),
                run.getGeneratedCount(),
                run.getErrorCount(),
                run.getErrorMessage(),
                run.getCreatedAt(),
                run.getUpdatedAt()
        );
    }
}
