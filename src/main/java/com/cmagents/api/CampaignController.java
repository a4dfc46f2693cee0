package com.cmagents.api;

import com.cmagents.artifact.ArtifactDocument;
import com.cmagents.config.CampaignAgentsProperties;
import com.cmagents.orchestration.CampaignOrchestrator;
import com.cmagents.orchestration.api.RunLedgerService;
import com.cmagents.orchestration.model.ContentRequest;
import com.cmagents.orchestration.model.RunResult;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.util.List;

@RestController
@RequestMapping("/api/v1/campaigns")
public class CampaignController {

    private final CampaignOrchestrator orchestrator;
    private final RunLedgerService runLedgerService;
    private final CampaignAgentsProperties properties;
    private final Clock clock;

    public CampaignController(CampaignOrchestrator orchestrator,
                              RunLedgerService runLedgerService,
                              CampaignAgentsProperties properties,
                              Clock clock) {
        this.orchestrator = orchestrator;
        this.runLedgerService = runLedgerService;
        this.properties = properties;
        this.clock = clock;
    }

    @PostMapping("/runs")
    public RunResponse run(@Valid @RequestBody CampaignRunRequest request) {
        RunResult result = orchestrator.runCampaign(toContentRequest(request));
        return RunResponse.from(result);
    }

    @PostMapping("/runs/async")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public AsyncRunResponse runAsync(@Valid @RequestBody CampaignRunRequest request) {
        String runId = orchestrator.startAsync(toContentRequest(request));
        return new AsyncRunResponse(runId, "queued", clock.instant());
    }

    @PostMapping("/runs/{runId}/cancel")
    public CancelRunResponse cancel(@PathVariable String runId) {
        return orchestrator.cancel(runId) ? CancelRunResponse.success(runId) : CancelRunResponse.notFound(runId);
    }

    @GetMapping("/runs/{runId}")
    public RunStatusResponse get(@PathVariable String runId) {
        return runLedgerService.find(runId)
                .map(run -> RunStatusResponse.from(run, orchestrator.isActive(runId)))
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Run " + runId + " not found."));
    }

    @GetMapping("/runs")
    public List<RunStatusResponse> recent(@RequestParam String brandId) {
        return runLedgerService.recent(brandId).stream()
                .map(run -> RunStatusResponse.from(run, orchestrator.isActive(run.getRunId())))
                .toList();
    }

    @PostMapping("/plan")
    public ArtifactDocument.Plan plan(@Valid @RequestBody CampaignRunRequest request) {
        return ArtifactDocument.Plan.of(orchestrator.plan(toContentRequest(request)));
    }

    private ContentRequest toContentRequest(CampaignRunRequest request) {
        return request.toContentRequest(properties.getExecution().getDefaultMaxRetries());
    }
}
