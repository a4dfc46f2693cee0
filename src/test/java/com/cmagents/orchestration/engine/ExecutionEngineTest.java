package com.cmagents.orchestration.engine;

import com.cmagents.artifact.ArtifactHandle;
import com.cmagents.artifact.ArtifactStore;
import com.cmagents.artifact.ArtifactStoreException;
import com.cmagents.config.CampaignAgentsProperties;
import com.cmagents.orchestration.model.ContentRequest;
import com.cmagents.orchestration.model.ErrorKind;
import com.cmagents.orchestration.model.OrchestrationTrace;
import com.cmagents.orchestration.model.OutcomeStatus;
import com.cmagents.orchestration.model.PlanMode;
import com.cmagents.orchestration.model.RunStatus;
import com.cmagents.orchestration.model.WorkerName;
import com.cmagents.orchestration.model.WorkerOutcome;
import com.cmagents.orchestration.model.WorkerPlan;
import com.cmagents.orchestration.model.WorkerStep;
import com.cmagents.orchestration.worker.CampaignWorker;
import com.cmagents.orchestration.worker.FatalWorkerException;
import com.cmagents.orchestration.worker.TransientWorkerException;
import com.cmagents.orchestration.worker.WorkerContext;
import com.cmagents.orchestration.worker.WorkerRegistry;
import com.cmagents.orchestration.worker.WorkerResult;
import com.cmagents.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class ExecutionEngineTest {

    private final MutableClock clock = MutableClock.at("2025-03-01T10:00:00Z");
    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final CampaignAgentsProperties properties = new CampaignAgentsProperties();
    private final ArtifactStore artifactStore = mock(ArtifactStore.class);
    private final Map<WorkerName, StubWorker> workers = new EnumMap<>(WorkerName.class);

    @BeforeEach
    void setUp() {
        properties.getExecution().setRetryBackoff(Duration.ZERO);
        properties.getExecution().setWorkerTimeout(Duration.ofSeconds(5));
        for (WorkerName name : WorkerName.values()) {
            workers.put(name, new StubWorker(name, context -> WorkerResult.ok(name.key() + "-output")));
        }
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private ExecutionEngine engine() {
        return new ExecutionEngine(new WorkerRegistry(new ArrayList<>(workers.values())), artifactStore, executor,
                properties, clock);
    }

    private static WorkerPlan plan(Boolean... runs) {
        List<WorkerStep> steps = new ArrayList<>();
        for (WorkerName name : WorkerName.values()) {
            steps.add(WorkerStep.of(name, runs[name.order()], "planned " + name.key()));
        }
        return new WorkerPlan(steps, PlanMode.FALLBACK, "test plan");
    }

    private static ContentRequest request(int maxRetries) {
        return ContentRequest.builder()
                .objective("Autumn launch")
                .brandId("cafe-sol")
                .build(true)
                .includeText(false)
                .maxRetries(maxRetries)
                .styleRefPresent(true)
                .build();
    }

    private ExecutionReport execute(ContentRequest request, WorkerPlan plan) {
        return engine().execute("run-1", request, plan, Map.of("brand", "cafe-sol"), new RunCancellation("run-1"),
                null);
    }

    private static List<String> steps(OrchestrationTrace trace) {
        return trace.entries().stream()
                .map(entry -> entry.step().key() + ":" + entry.status().name().toLowerCase())
                .toList();
    }

    @Test
    void qaRejectionOnceRegeneratesWithFeedback() {
        workers.put(WorkerName.QA, new StubWorker(WorkerName.QA, context -> context.attempt() == 1
                ? WorkerResult.rejected("verdict-1", List.of("product too dark"))
                : WorkerResult.ok("verdict-2")));

        ExecutionReport report = execute(request(1), plan(false, false, true, true, true));

        assertEquals(RunStatus.SUCCEEDED, report.status());
        assertEquals(List.of("research:skipped", "copy:skipped", "design:succeeded", "generate:succeeded",
                "qa:rejected", "generate:succeeded", "qa:succeeded"), steps(report.trace()));
        assertEquals(2, report.trace().invocations(WorkerName.GENERATE));
        WorkerContext retry = workers.get(WorkerName.GENERATE).contexts.get(1);
        assertEquals(2, retry.attempt());
        assertEquals(List.of("product too dark"), retry.qaFeedback());
        assertEquals("design-output", retry.output(WorkerName.DESIGN));
        assertTrue(report.trace().sealed());
        assertEquals("verdict-2", report.context().output(WorkerName.QA));
    }

    @Test
    void exhaustedRetriesDegradeTheRun() {
        workers.put(WorkerName.QA, new StubWorker(WorkerName.QA,
                context -> WorkerResult.rejected(null, List.of("blurry " + context.attempt()))));

        ExecutionReport report = execute(request(2), plan(true, true, true, true, true));

        assertEquals(RunStatus.DEGRADED, report.status());
        assertEquals(3, report.trace().invocations(WorkerName.GENERATE));
        assertEquals(3, report.trace().count(WorkerName.QA, OutcomeStatus.REJECTED));
        assertEquals(List.of("blurry 1", "blurry 2"), workers.get(WorkerName.GENERATE).contexts.get(2).qaFeedback());
    }

    @Test
    void transientFailureIsRetriedAndRecorded() {
        int[] calls = {0};
        workers.put(WorkerName.DESIGN, new StubWorker(WorkerName.DESIGN, context -> {
            if (calls[0]++ == 0) {
                throw new TransientWorkerException("connection reset");
            }
            return WorkerResult.ok("design-output");
        }));

        ExecutionReport report = execute(request(1), plan(false, false, true, true, true));

        assertEquals(RunStatus.SUCCEEDED, report.status());
        WorkerOutcome failed = report.trace().entries().get(2);
        assertEquals(WorkerName.DESIGN, failed.step());
        assertEquals(OutcomeStatus.FAILED, failed.status());
        assertEquals(ErrorKind.TRANSIENT, failed.errorKind());
        assertTrue(failed.message().contains("connection reset"));
        assertEquals(OutcomeStatus.SUCCEEDED, report.trace().entries().get(3).status());
        assertEquals(2, report.trace().invocations(WorkerName.DESIGN));
    }

    @Test
    void persistentTransientFailureDegradesAndContinues() {
        properties.getExecution().setTransientRetries(2);
        workers.put(WorkerName.COPY, new StubWorker(WorkerName.COPY, context -> {
            throw new TransientWorkerException("rate limited");
        }));

        ExecutionReport report = execute(request(0), plan(false, true, true, true, false));

        assertEquals(RunStatus.DEGRADED, report.status());
        assertEquals(3, report.trace().count(WorkerName.COPY, OutcomeStatus.FAILED));
        assertEquals(1, report.trace().count(WorkerName.DESIGN, OutcomeStatus.SUCCEEDED));
        assertEquals(1, report.trace().count(WorkerName.GENERATE, OutcomeStatus.SUCCEEDED));
        assertNull(report.context().output(WorkerName.COPY));
    }

    @Test
    void fatalFailureAbortsTheRun() {
        workers.put(WorkerName.RESEARCH, new StubWorker(WorkerName.RESEARCH, context -> {
            throw new FatalWorkerException("brand config unreadable");
        }));

        ExecutionReport report = execute(request(1), plan(true, true, true, true, true));

        assertEquals(RunStatus.FAILED, report.status());
        assertEquals(List.of("research:failed"), steps(report.trace()));
        assertEquals(ErrorKind.FATAL, report.trace().entries().get(0).errorKind());
        assertTrue(workers.get(WorkerName.COPY).contexts.isEmpty());
    }

    @Test
    void unexpectedExceptionIsTreatedAsFatal() {
        workers.put(WorkerName.GENERATE, new StubWorker(WorkerName.GENERATE, context -> {
            throw new IllegalArgumentException("bad size");
        }));

        ExecutionReport report = execute(request(1), plan(false, false, false, true, true));

        assertEquals(RunStatus.FAILED, report.status());
        WorkerOutcome last = report.trace().entries().get(report.trace().size() - 1);
        assertEquals(WorkerName.GENERATE, last.step());
        assertTrue(last.message().contains("bad size"));
    }

    @Test
    void timedOutWorkerCountsAsTransient() {
        properties.getExecution().setWorkerTimeout(Duration.ofMillis(50));
        properties.getExecution().setTransientRetries(0);
        workers.put(WorkerName.DESIGN, new StubWorker(WorkerName.DESIGN, context -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            return WorkerResult.ok("late");
        }));

        ExecutionReport report = execute(request(0), plan(false, false, true, true, false));

        assertEquals(RunStatus.DEGRADED, report.status());
        WorkerOutcome timedOut = report.trace().entries().get(2);
        assertEquals(ErrorKind.TRANSIENT, timedOut.errorKind());
        assertTrue(timedOut.message().contains("timed out"));
    }

    @Test
    void cancelledRunStopsBeforeTheNextStep() {
        RunCancellation cancellation = new RunCancellation("run-1");
        workers.put(WorkerName.COPY, new StubWorker(WorkerName.COPY, context -> {
            cancellation.cancel("user request");
            return WorkerResult.ok("copy-output");
        }));

        ExecutionReport report = engine().execute("run-1", request(1), plan(true, true, true, true, true), Map.of(),
                cancellation, null);

        assertEquals(RunStatus.CANCELLED, report.status());
        assertEquals(List.of("research:succeeded", "copy:succeeded", "design:cancelled"), steps(report.trace()));
        assertTrue(workers.get(WorkerName.DESIGN).contexts.isEmpty());
    }

    @Test
    void skippedGenerateAlsoSkipsQa() {
        ExecutionReport report = execute(request(1), plan(true, true, true, false, true));

        assertEquals(RunStatus.SUCCEEDED, report.status());
        WorkerOutcome qa = report.trace().entries().get(4);
        assertEquals(OutcomeStatus.SKIPPED, qa.status());
        assertEquals("generate skipped", qa.message());
        assertTrue(workers.get(WorkerName.QA).contexts.isEmpty());
    }

    @Test
    void disabledQaRunsGenerateOnce() {
        ExecutionReport report = execute(request(0), plan(false, false, true, true, false));

        assertEquals(RunStatus.SUCCEEDED, report.status());
        assertEquals(1, report.trace().invocations(WorkerName.GENERATE));
        WorkerOutcome qa = report.trace().entries().get(4);
        assertEquals(OutcomeStatus.SKIPPED, qa.status());
        assertEquals("planned qa", qa.message());
    }

    @Test
    void journalsEveryOutcomeAndToleratesStoreFailures() {
        ArtifactHandle handle = mock(ArtifactHandle.class);
        doThrow(new ArtifactStoreException("disk full")).when(artifactStore)
                .appendTrace(eq(handle), any(WorkerOutcome.class));

        ExecutionReport report = engine().execute("run-1", request(0), plan(false, false, true, true, false), Map.of(),
                new RunCancellation("run-1"), handle);

        assertEquals(RunStatus.SUCCEEDED, report.status());
        assertEquals(5, report.trace().size());
        verify(artifactStore, times(5)).appendTrace(eq(handle), any(WorkerOutcome.class));
    }

    private static final class StubWorker implements CampaignWorker {

        private final WorkerName name;
        private final Function<WorkerContext, WorkerResult> behavior;
        private final List<WorkerContext> contexts = new CopyOnWriteArrayList<>();

        private StubWorker(WorkerName name, Function<WorkerContext, WorkerResult> behavior) {
            this.name = name;
            this.behavior = behavior;
        }

        @Override
        public WorkerName name() {
            return name;
        }

        @Override
        public WorkerResult run(WorkerContext context) {
            contexts.add(context);
            return behavior.apply(context);
        }
    }
}
