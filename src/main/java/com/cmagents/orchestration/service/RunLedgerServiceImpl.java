package com.cmagents.orchestration.service;

import com.cmagents.entity.CampaignRun;
import com.cmagents.orchestration.api.RunLedgerService;
import com.cmagents.orchestration.model.ContentRequest;
import com.cmagents.orchestration.model.RunResult;
import com.cmagents.orchestration.model.RunStatus;
import com.cmagents.orchestration.model.WorkerPlan;
import com.cmagents.repository.CampaignRunRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
@Slf4j
public class RunLedgerServiceImpl implements RunLedgerService {

    private final CampaignRunRepository repository;

    public RunLedgerServiceImpl(CampaignRunRepository repository) {
        this.repository = repository;
    }

    @Override
    public void recordStarted(String runId, ContentRequest request, WorkerPlan plan) {
        try {
            CampaignRun run = repository.findByRunId(runId).orElseGet(() -> newRun(runId, request));
            run.setPlanMode(plan.mode().label());
            run.setWorkerSequence(String.join(",", plan.sequence()));
            run.setStatus(RunStatus.RUNNING.name());
            repository.save(run);
        } catch (Exception ex) {
            log.warn("Failed to record start of run {}: {}", runId, ex.getMessage());
        }
    }

    @Override
    public void recordCompleted(RunResult result) {
        try {
            CampaignRun run = repository.findByRunId(result.runId())
                    .orElseGet(() -> newRun(result.runId(), result.request()));
            run.setPlanMode(result.plan().mode().label());
            run.setWorkerSequence(String.join(",", result.plan().sequence()));
            run.setStatus(result.status().name());
            run.setArtifactPath(result.artifact() != null ? result.artifact().directory() : null);
            run.setCostUsd(result.totalCostUsd());
            run.setDurationMs(result.duration().toMillis());
            run.setGeneratedCount(result.generatedCount());
            run.setErrorCount(result.errorCount());
            repository.save(run);
        } catch (Exception ex) {
            log.warn("Failed to record completion of run {}: {}", result.runId(), ex.getMessage());
        }
    }

    @Override
    public void recordFailed(String runId, ContentRequest request, String message) {
        try {
            CampaignRun run = repository.findByRunId(runId).orElseGet(() -> newRun(runId, request));
            run.setStatus(RunStatus.FAILED.name());
            run.setErrorMessage(message);
            repository.save(run);
        } catch (Exception ex) {
            log.warn("Failed to record failure of run {}: {}", runId, ex.getMessage());
        }
    }

    @Override
    public Optional<CampaignRun> find(String runId) {
        return repository.findByRunId(runId);
    }

    @Override
    public List<CampaignRun> recent(String brandId) {
        return repository.findTop20ByBrandIdOrderByCreatedAtDesc(brandId);
    }

    private CampaignRun newRun(String runId, ContentRequest request) {
        return CampaignRun.builder()
                .runId(runId)
                .brandId(request.brandId())
                .campaignId(request.campaignId())
                .objective(request.objective())
                .status(RunStatus.RUNNING.name())
                .build();
    }
}
