package com.cmagents.artifact;

import com.cmagents.orchestration.model.ContentRequest;
import com.cmagents.orchestration.model.InputTranslation;
import com.cmagents.orchestration.model.RunResult;
import com.cmagents.orchestration.model.WorkerOutcome;
import com.cmagents.orchestration.model.WorkerPlan;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Layout of {@code artifacts.json}.
 */
public record ArtifactDocument(
        @JsonProperty("run_id") String runId,
        @JsonProperty("created_at") String createdAt,
        @JsonProperty("input") Input input,
        @JsonProperty("worker_plan") Plan workerPlan,
        @JsonProperty("orchestration_trace") List<TraceEntry> orchestrationTrace,
        @JsonProperty("input_translation") @Nullable InputTranslation inputTranslation,
        @JsonProperty("result") Result result
) {

    public record Input(
            @JsonProperty("brand") String brand,
            @JsonProperty("campaign") @Nullable String campaign,
            @JsonProperty("products") List<String> products,
            @JsonProperty("objective") String objective,
            @JsonProperty("days") int days,
            @JsonProperty("build") boolean build,
            @JsonProperty("include_text") boolean includeText,
            @JsonProperty("style_ref_present") boolean styleRefPresent,
            @JsonProperty("max_retries") int maxRetries,
            @JsonProperty("constraints") String constraints
    ) {
        static Input of(ContentRequest request) {
            return new Input(request.brandId(), request.campaignId(), request.productIds(), request.objective(),
                    request.days(), request.build(), request.includeText(), request.styleRefPresent(),
                    request.maxRetries(), request.constraints());
        }
    }

    public record Plan(
            @JsonProperty("sequence") List<String> sequence,
            @JsonProperty("mode") String mode,
            @JsonProperty("reason") String reason,
            @JsonProperty("workers") List<PlanWorker> workers
    ) {
        public static Plan of(WorkerPlan plan) {
            List<PlanWorker> workers = plan.steps().stream()
                    .map(step -> new PlanWorker(step.name().key(), step.willRun(), step.reason(), step.order()))
                    .toList();
            return new Plan(plan.sequence(), plan.mode().label(), plan.reason(), workers);
        }
    }

    public record PlanWorker(
            @JsonProperty("name") String name,
            @JsonProperty("run") boolean run,
            @JsonProperty("reason") String reason,
            @JsonProperty("order") int order
    ) {
    }

    public record TraceEntry(
            @JsonProperty("step") String step,
            @JsonProperty("status") String status,
            @JsonProperty("attempt") int attempt,
            @JsonProperty("message") String message,
            @JsonProperty("error_kind") @Nullable String errorKind,
            @JsonProperty("cost_usd") double costUsd,
            @JsonProperty("timestamp") String timestamp,
            @JsonProperty("payload") @Nullable Object payload
    ) {
        public static TraceEntry of(WorkerOutcome outcome) {
            return new TraceEntry(outcome.step().key(),
                    outcome.status().name().toLowerCase(Locale.ROOT),
                    outcome.attempt(),
                    outcome.message(),
                    outcome.errorKind() == null ? null : outcome.errorKind().name().toLowerCase(Locale.ROOT),
                    outcome.costUsd(),
                    outcome.timestamp().toString(),
                    outcome.payload());
        }
    }

    public record Result(
            @JsonProperty("status") String status,
            @JsonProperty("cost_usd") double costUsd,
            @JsonProperty("duration_ms") long durationMs,
            @JsonProperty("generated") long generated,
            @JsonProperty("errors") long errors
    ) {
    }

    static ArtifactDocument of(RunResult result, Instant createdAt) {
        List<TraceEntry> trace = result.trace().entries().stream().map(TraceEntry::of).toList();
        Result summary = new Result(result.status().name(), result.totalCostUsd(), result.duration().toMillis(),
                result.generatedCount(), result.errorCount());
        return new ArtifactDocument(result.runId(), createdAt.toString(), Input.of(result.request()),
                Plan.of(result.plan()), trace, result.translation(), summary);
    }
}
