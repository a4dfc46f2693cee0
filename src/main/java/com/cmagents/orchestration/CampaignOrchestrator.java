package com.cmagents.orchestration;

import com.cmagents.artifact.ArtifactHandle;
import com.cmagents.artifact.ArtifactReference;
import com.cmagents.artifact.ArtifactStore;
import com.cmagents.artifact.ArtifactStoreException;
import com.cmagents.brand.BrandCatalog;
import com.cmagents.brand.BrandProfile;
import com.cmagents.config.CampaignAgentsProperties;
import com.cmagents.orchestration.api.RunLedgerService;
import com.cmagents.orchestration.engine.ExecutionEngine;
import com.cmagents.orchestration.engine.ExecutionReport;
import com.cmagents.orchestration.engine.RunCancellation;
import com.cmagents.orchestration.model.ContentRequest;
import com.cmagents.orchestration.model.InputTranslation;
import com.cmagents.orchestration.model.PlanSignals;
import com.cmagents.orchestration.model.RunResult;
import com.cmagents.orchestration.model.WorkerPlan;
import com.cmagents.orchestration.planning.PlanResolver;
import com.cmagents.orchestration.service.IntentDetectionService;
import com.cmagents.orchestration.service.RequestTranslationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * Entry point for campaign runs: resolves the plan, executes it and seals the artifact.
 * Worker problems end up in the returned {@link RunResult}; only invalid requests throw.
 */
@Service
@Slf4j
public class CampaignOrchestrator {

    private static final DateTimeFormatter RUN_ID_TIME = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final PlanResolver planResolver;
    private final ExecutionEngine executionEngine;
    private final ArtifactStore artifactStore;
    private final BrandCatalog brandCatalog;
    private final IntentDetectionService intentDetectionService;
    private final RequestTranslationService requestTranslationService;
    private final RunLedgerService runLedgerService;
    private final ExecutorService orchestrationExecutor;
    private final CampaignAgentsProperties properties;
    private final Clock clock;
    private final Map<String, RunCancellation> activeRuns = new ConcurrentHashMap<>();

    public CampaignOrchestrator(PlanResolver planResolver,
                                ExecutionEngine executionEngine,
                                ArtifactStore artifactStore,
                                BrandCatalog brandCatalog,
                                IntentDetectionService intentDetectionService,
                                RequestTranslationService requestTranslationService,
                                RunLedgerService runLedgerService,
                                @Qualifier("orchestrationExecutor") ExecutorService orchestrationExecutor,
                                CampaignAgentsProperties properties,
                                Clock clock) {
        this.planResolver = planResolver;
        this.executionEngine = executionEngine;
        this.artifactStore = artifactStore;
        this.brandCatalog = brandCatalog;
        this.intentDetectionService = intentDetectionService;
        this.requestTranslationService = requestTranslationService;
        this.runLedgerService = runLedgerService;
        this.orchestrationExecutor = orchestrationExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    public RunResult runCampaign(ContentRequest request) {
        String runId = newRunId();
        return runCampaign(runId, request, null, register(runId));
    }

    public RunResult runCampaign(String runId,
                                 ContentRequest request,
                                 @Nullable InputTranslation translation,
                                 RunCancellation cancellation) {
        Instant started = clock.instant();
        activeRuns.put(runId, cancellation);
        log.info("Run {} started for brand {}: {}", runId, request.brandId(), request.objective());
        try (ArtifactHandle artifact = openArtifact(runId)) {
            BrandProfile brand = brand(request.brandId());
            PlanSignals signals = signals(request, brand);
            ContentRequest effective = signals.noTextRequested() && request.includeText()
                    ? request.toBuilder().includeText(false).build()
                    : request;
            WorkerPlan plan = planResolver.resolve(effective, signals);
            runLedgerService.recordStarted(runId, effective, plan);

            ExecutionReport report = executionEngine.execute(runId, effective, plan, brand.asContext(), cancellation,
                    artifact);
            RunResult result = new RunResult(runId, effective, plan, report.trace(), report.status(), null,
                    report.totalCostUsd(), Duration.between(started, clock.instant()), translation);
            if (artifact != null) {
                result = result.withArtifact(seal(artifact, result));
            }
            runLedgerService.recordCompleted(result);
            log.info("Run {} completed: status={}, cost=${}, duration={} ms", runId, result.status(),
                    result.totalCostUsd(), result.duration().toMillis());
            return result;
        } finally {
            activeRuns.remove(runId, cancellation);
        }
    }

    /**
     * Translates a chat request into run parameters and runs it.
     */
    public RunResult runFromUserInput(String runId, String brandId, String userRequest, RunCancellation cancellation) {
        InputTranslation translation = requestTranslationService.translate(brand(brandId), userRequest);
        log.info("Run {} input translated ({}): {}", runId, translation.mode(), translation.reason());
        ContentRequest request = translation.toRequest(brandId, properties.getExecution().getDefaultMaxRetries(), false);
        return runCampaign(runId, request, translation, cancellation);
    }

    /**
     * Starts a run on the orchestration executor and returns its id immediately. The
     * result is recorded in the run ledger.
     */
    public String startAsync(ContentRequest request) {
        String runId = newRunId();
        RunCancellation cancellation = register(runId);
        CompletableFuture.runAsync(() -> {
            try {
                runCampaign(runId, request, null, cancellation);
            } catch (Exception ex) {
                log.error("Run {} failed unexpectedly", runId, ex);
                runLedgerService.recordFailed(runId, request, String.valueOf(ex.getMessage()));
            }
        }, orchestrationExecutor);
        return runId;
    }

    /**
     * Resolves the plan a request would run with, without executing anything.
     */
    public WorkerPlan plan(ContentRequest request) {
        return planResolver.resolve(request, signals(request, brand(request.brandId())));
    }

    public RunCancellation register(String runId) {
        return activeRuns.computeIfAbsent(runId, RunCancellation::new);
    }

    /**
     * Makes a run started by another owner cancellable through {@link #cancel(String)}.
     */
    public void track(RunCancellation cancellation) {
        activeRuns.putIfAbsent(cancellation.runId(), cancellation);
    }

    public boolean cancel(String runId) {
        RunCancellation cancellation = activeRuns.get(runId);
        if (cancellation == null) {
            return false;
        }
        if (cancellation.cancel("cancelled by request")) {
            log.info("Run {} cancellation requested", runId);
        }
        return true;
    }

    public boolean isActive(String runId) {
        return activeRuns.containsKey(runId);
    }

    public String newRunId() {
        String time = RUN_ID_TIME.withZone(ZoneId.systemDefault()).format(clock.instant());
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 6);
        return OrchestrationConstants.RUN_ID_PREFIX + time + "-" + suffix;
    }

    PlanSignals signals(ContentRequest request, BrandProfile brand) {
        String text = request.freeText();
        return new PlanSignals(request.styleRefPresent(), brand.hasReferences(),
                intentDetectionService.requestsTrends(text), intentDetectionService.requestsNoText(text));
    }

    private BrandProfile brand(String brandId) {
        return brandCatalog.find(brandId).orElseGet(() -> {
            log.warn("Brand {} not found; planning without brand references", brandId);
            return BrandProfile.unknown(brandId);
        });
    }

    private @Nullable ArtifactHandle openArtifact(String runId) {
        try {
            return artifactStore.open(runId);
        } catch (ArtifactStoreException ex) {
            log.error("Run {}: artifact store unavailable, running without artifact: {}", runId, ex.getMessage());
            return null;
        }
    }

    private @Nullable ArtifactReference seal(ArtifactHandle artifact, RunResult result) {
        try {
            return artifactStore.seal(artifact, result);
        } catch (ArtifactStoreException ex) {
            log.error("Run {}: failed to seal artifact: {}", result.runId(), ex.getMessage());
            return null;
        }
    }
}
