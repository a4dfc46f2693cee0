package com.cmagents.orchestration.engine;

import com.cmagents.artifact.ArtifactHandle;
import com.cmagents.artifact.ArtifactStore;
import com.cmagents.artifact.ArtifactStoreException;
import com.cmagents.config.CampaignAgentsProperties;
import com.cmagents.orchestration.model.ContentRequest;
import com.cmagents.orchestration.model.ErrorKind;
import com.cmagents.orchestration.model.OrchestrationTrace;
import com.cmagents.orchestration.model.RunStatus;
import com.cmagents.orchestration.model.WorkerName;
import com.cmagents.orchestration.model.WorkerOutcome;
import com.cmagents.orchestration.model.WorkerPlan;
import com.cmagents.orchestration.worker.CampaignWorker;
import com.cmagents.orchestration.worker.FatalWorkerException;
import com.cmagents.orchestration.worker.TransientWorkerException;
import com.cmagents.orchestration.worker.WorkerContext;
import com.cmagents.orchestration.worker.WorkerRegistry;
import com.cmagents.orchestration.worker.WorkerResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a resolved plan step by step, awaiting each worker call before the next one.
 * <p>
 * A call that misses its deadline is interrupted and the engine stops waiting for it.
 * A worker that ignores the interrupt may still be running while the retry or the
 * next step starts, so workers must not share mutable state across calls.
 */
@Service
@Slf4j
public class ExecutionEngine {

    private static final List<WorkerName> PREPARATION_STEPS = List.of(WorkerName.RESEARCH, WorkerName.COPY,
            WorkerName.DESIGN);

    private final WorkerRegistry workers;
    private final ArtifactStore artifactStore;
    private final ExecutorService workerExecutor;
    private final CampaignAgentsProperties.ExecutionConfig config;
    private final Clock clock;

    public ExecutionEngine(WorkerRegistry workers,
                           ArtifactStore artifactStore,
                           @Qualifier("workerExecutor") ExecutorService workerExecutor,
                           CampaignAgentsProperties properties,
                           Clock clock) {
        this.workers = workers;
        this.artifactStore = artifactStore;
        this.workerExecutor = workerExecutor;
        this.config = properties.getExecution();
        this.clock = clock;
    }

    public ExecutionReport execute(String runId,
                                   ContentRequest request,
                                   WorkerPlan plan,
                                   Map<String, Object> brandContext,
                                   RunCancellation cancellation,
                                   @Nullable ArtifactHandle artifact) {
        Run run = new Run(new OrchestrationTrace(runId), artifact, cancellation,
                WorkerContext.initial(runId, request, brandContext));

        for (WorkerName name : PREPARATION_STEPS) {
            if (!plan.willRun(name)) {
                run.record(WorkerOutcome.skipped(name, plan.step(name).reason(), clock.instant()));
                continue;
            }
            Invocation invocation = invoke(run, name, 1);
            switch (invocation.kind()) {
                case COMPLETED -> {
                    if (invocation.result().success()) {
                        run.context = run.context.withOutput(name, invocation.result().payload());
                    } else {
                        run.degraded = true;
                    }
                }
                case FAILED -> run.degraded = true;
                case FATAL -> {
                    return run.finish(RunStatus.FAILED);
                }
                case CANCELLED -> {
                    return run.finish(RunStatus.CANCELLED);
                }
            }
        }

        if (!plan.willRun(WorkerName.GENERATE)) {
            run.record(WorkerOutcome.skipped(WorkerName.GENERATE, plan.step(WorkerName.GENERATE).reason(),
                    clock.instant()));
            String qaReason = plan.willRun(WorkerName.QA) ? "generate skipped" : plan.step(WorkerName.QA).reason();
            run.record(WorkerOutcome.skipped(WorkerName.QA, qaReason, clock.instant()));
            return run.finish(run.degraded ? RunStatus.DEGRADED : RunStatus.SUCCEEDED);
        }

        if (!plan.willRun(WorkerName.QA)) {
            Invocation generated = invoke(run, WorkerName.GENERATE, 1);
            switch (generated.kind()) {
                case FATAL -> {
                    return run.finish(RunStatus.FAILED);
                }
                case CANCELLED -> {
                    return run.finish(RunStatus.CANCELLED);
                }
                case FAILED -> run.degraded = true;
                case COMPLETED -> {
                    if (generated.result().success()) {
                        run.context = run.context.withOutput(WorkerName.GENERATE, generated.result().payload());
                    } else {
                        run.degraded = true;
                    }
                }
            }
            run.record(WorkerOutcome.skipped(WorkerName.QA, plan.step(WorkerName.QA).reason(), clock.instant()));
            return run.finish(run.degraded ? RunStatus.DEGRADED : RunStatus.SUCCEEDED);
        }

        return qualityLoop(run, request.maxRetries());
    }

    private ExecutionReport qualityLoop(Run run, int maxRetries) {
        QualityLoopState state = QualityLoopState.GENERATE;
        int attempt = 1;
        int retriesUsed = 0;
        List<String> feedback = List.of();
        while (true) {
            switch (state) {
                case GENERATE -> {
                    Invocation generated = invoke(run, WorkerName.GENERATE, attempt);
                    if (generated.kind() == Invocation.Kind.FATAL) {
                        return run.finish(RunStatus.FAILED);
                    }
                    if (generated.kind() == Invocation.Kind.CANCELLED) {
                        return run.finish(RunStatus.CANCELLED);
                    }
                    if (generated.kind() == Invocation.Kind.COMPLETED && generated.result().success()) {
                        run.context = run.context.withOutput(WorkerName.GENERATE, generated.result().payload());
                        state = QualityLoopState.EVALUATE;
                    } else {
                        feedback = List.of("generate attempt " + attempt + " failed: " + generated.message());
                        state = retriesUsed < maxRetries ? QualityLoopState.RETRY : QualityLoopState.EXHAUSTED;
                    }
                }
                case EVALUATE -> {
                    Invocation verdict = invoke(run, WorkerName.QA, attempt);
                    if (verdict.kind() == Invocation.Kind.FATAL) {
                        return run.finish(RunStatus.FAILED);
                    }
                    if (verdict.kind() == Invocation.Kind.CANCELLED) {
                        return run.finish(RunStatus.CANCELLED);
                    }
                    if (verdict.kind() == Invocation.Kind.COMPLETED && verdict.result().success()) {
                        run.context = run.context.withOutput(WorkerName.QA, verdict.result().payload());
                        state = QualityLoopState.ACCEPTED;
                    } else {
                        feedback = verdict.kind() == Invocation.Kind.COMPLETED
                                ? verdict.result().feedback()
                                : List.of("qa attempt " + attempt + " failed: " + verdict.message());
                        state = retriesUsed < maxRetries ? QualityLoopState.RETRY : QualityLoopState.EXHAUSTED;
                    }
                }
                case RETRY -> {
                    retriesUsed++;
                    attempt++;
                    log.info("Run {}: qa retry {}/{} with feedback {}", run.trace.runId(), retriesUsed, maxRetries,
                            feedback);
                    run.context = run.context.withFeedback(feedback).forAttempt(attempt);
                    state = QualityLoopState.GENERATE;
                }
                case ACCEPTED -> {
                    return run.finish(run.degraded ? RunStatus.DEGRADED : RunStatus.SUCCEEDED);
                }
                case EXHAUSTED -> {
                    log.warn("Run {}: qa retries exhausted after {} attempts", run.trace.runId(), attempt);
                    return run.finish(RunStatus.DEGRADED);
                }
            }
        }
    }

    /**
     * Calls a worker, retrying transient failures up to the configured bound. Every
     * failed try is recorded; the final outcome is recorded too.
     */
    private Invocation invoke(Run run, WorkerName name, int attempt) {
        CampaignWorker worker = workers.get(name);
        int maxTries = config.getTransientRetries() + 1;
        for (int tryNumber = 1; ; tryNumber++) {
            if (run.cancellation.isCancelled()) {
                run.record(WorkerOutcome.cancelled(name, attempt, clock.instant()));
                return Invocation.cancelled();
            }
            WorkerContext context = run.context.forAttempt(attempt);
            try {
                WorkerResult result = callWithDeadline(worker, context);
                if (result.success()) {
                    run.record(WorkerOutcome.succeeded(name, result.payload(), "", attempt, result.costUsd(),
                            clock.instant()));
                } else {
                    run.record(WorkerOutcome.rejected(name, result.payload(), String.join("; ", result.feedback()),
                            attempt, result.costUsd(), clock.instant()));
                }
                return Invocation.completed(result);
            } catch (TransientWorkerException ex) {
                String message = "try " + tryNumber + "/" + maxTries + ": " + ex.getMessage();
                run.record(WorkerOutcome.failed(name, ErrorKind.TRANSIENT, message, attempt, clock.instant()));
                if (tryNumber >= maxTries) {
                    log.warn("Run {}: {} failed after {} tries: {}", run.trace.runId(), name.key(), maxTries,
                            ex.getMessage());
                    return Invocation.failed(ex.getMessage());
                }
                if (!backoff(tryNumber)) {
                    run.record(WorkerOutcome.cancelled(name, attempt, clock.instant()));
                    return Invocation.cancelled();
                }
            } catch (FatalWorkerException ex) {
                log.error("Run {}: {} failed fatally: {}", run.trace.runId(), name.key(), ex.getMessage());
                run.record(WorkerOutcome.failed(name, ErrorKind.FATAL, String.valueOf(ex.getMessage()), attempt,
                        clock.instant()));
                return Invocation.fatal(ex.getMessage());
            } catch (RuntimeException ex) {
                log.error("Run {}: {} could not be invoked", run.trace.runId(), name.key(), ex);
                run.record(WorkerOutcome.failed(name, ErrorKind.FATAL, ex.getClass().getSimpleName() + ": "
                        + ex.getMessage(), attempt, clock.instant()));
                return Invocation.fatal(ex.getMessage());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                run.cancellation.cancel("interrupted");
                run.record(WorkerOutcome.cancelled(name, attempt, clock.instant()));
                return Invocation.cancelled();
            }
        }
    }

    private WorkerResult callWithDeadline(CampaignWorker worker, WorkerContext context) throws InterruptedException {
        Duration timeout = config.getWorkerTimeout();
        Future<WorkerResult> future = workerExecutor.submit(() -> worker.run(context));
        try {
            WorkerResult result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (result == null) {
                throw new FatalWorkerException(worker.name().key() + " returned no result");
            }
            return result;
        } catch (TimeoutException ex) {
            future.cancel(true);
            throw new TransientWorkerException(worker.name().key() + " timed out after " + timeout.toMillis() + " ms",
                    ex);
        } catch (InterruptedException ex) {
            future.cancel(true);
            throw ex;
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            if (cause instanceof TransientWorkerException transientFailure) {
                throw transientFailure;
            }
            if (cause instanceof FatalWorkerException fatalFailure) {
                throw fatalFailure;
            }
            throw new FatalWorkerException(worker.name().key() + " raised " + cause.getClass().getSimpleName()
                    + ": " + cause.getMessage(), cause);
        }
    }

    private boolean backoff(int tryNumber) {
        long delay = config.getRetryBackoff().toMillis() * tryNumber;
        if (delay <= 0) {
            return true;
        }
        try {
            Thread.sleep(delay);
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private final class Run {
        private final OrchestrationTrace trace;
        private final @Nullable ArtifactHandle artifact;
        private final RunCancellation cancellation;
        private WorkerContext context;
        private boolean degraded;

        private Run(OrchestrationTrace trace, @Nullable ArtifactHandle artifact, RunCancellation cancellation,
                    WorkerContext context) {
            this.trace = trace;
            this.artifact = artifact;
            this.cancellation = cancellation;
            this.context = context;
        }

        private void record(WorkerOutcome outcome) {
            trace.append(outcome);
            if (artifact == null) {
                return;
            }
            try {
                artifactStore.appendTrace(artifact, outcome);
            } catch (ArtifactStoreException | IllegalStateException ex) {
                log.warn("Run {}: failed to journal {} outcome: {}", trace.runId(), outcome.step().key(),
                        ex.getMessage());
            }
        }

        private ExecutionReport finish(RunStatus status) {
            trace.seal(status);
            log.info("Run {} finished with status {} after {} trace entries", trace.runId(), status, trace.size());
            return new ExecutionReport(trace, status, trace.totalCostUsd(), context);
        }
    }

    private record Invocation(Kind kind, @Nullable WorkerResult result, String message) {

        enum Kind {
            COMPLETED,
            FAILED,
            FATAL,
            CANCELLED
        }

        static Invocation completed(WorkerResult result) {
            return new Invocation(Kind.COMPLETED, result, "");
        }

        static Invocation failed(String message) {
            return new Invocation(Kind.FAILED, null, String.valueOf(message));
        }

        static Invocation fatal(String message) {
            return new Invocation(Kind.FATAL, null, String.valueOf(message));
        }

        static Invocation cancelled() {
            return new Invocation(Kind.CANCELLED, null, "cancelled");
        }
    }
}
