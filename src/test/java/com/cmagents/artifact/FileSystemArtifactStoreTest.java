package com.cmagents.artifact;

import com.cmagents.orchestration.model.ContentRequest;
import com.cmagents.orchestration.model.InputTranslation;
import com.cmagents.orchestration.model.OrchestrationTrace;
import com.cmagents.orchestration.model.PlanMode;
import com.cmagents.orchestration.model.PlanSignals;
import com.cmagents.orchestration.model.RunResult;
import com.cmagents.orchestration.model.RunStatus;
import com.cmagents.orchestration.model.WorkerName;
import com.cmagents.orchestration.model.WorkerOutcome;
import com.cmagents.orchestration.model.WorkerPlan;
import com.cmagents.orchestration.planning.RuleBasedPlanProposer;
import com.cmagents.support.MutableClock;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class FileSystemArtifactStoreTest {

    private static final String RUN_ID = "run-20250301-100000-abc123";

    @TempDir
    Path root;

    private final MutableClock clock = MutableClock.at("2025-03-01T10:00:00Z");
    private final ObjectMapper objectMapper = Jackson2ObjectMapperBuilder.json().build();
    private FileSystemArtifactStore store;

    @BeforeEach
    void setUp() {
        store = new FileSystemArtifactStore(root, objectMapper, new RunSummaryRenderer(), clock);
    }

    private RunResult result(OrchestrationTrace trace) {
        ContentRequest request = ContentRequest.builder()
                .objective("Autumn latte launch")
                .brandId("cafe-sol")
                .build(true)
                .includeText(false)
                .styleRefPresent(true)
                .productIds(List.of("latte"))
                .build();
        WorkerPlan plan = new WorkerPlan(new RuleBasedPlanProposer().steps(request,
                new PlanSignals(true, false, false, false)), PlanMode.FALLBACK, "planning delegate unavailable");
        InputTranslation translation = new InputTranslation("Autumn latte launch", 3, true, false, List.of("latte"),
                "fallback_heuristic", "fallback");
        return new RunResult(RUN_ID, request, plan, trace, trace.status(), null, 0.12, Duration.ofMillis(850),
                translation);
    }

    private static OrchestrationTrace trace(Instant at, RunStatus status) {
        OrchestrationTrace trace = new OrchestrationTrace(RUN_ID);
        trace.append(WorkerOutcome.skipped(WorkerName.RESEARCH, "style references available", at));
        trace.append(WorkerOutcome.succeeded(WorkerName.GENERATE, "renders", "", 1, 0.12, at));
        trace.append(WorkerOutcome.succeeded(WorkerName.QA, "passed", "", 1, 0.0, at));
        trace.seal(status);
        return trace;
    }

    @Test
    void sealPublishesDocumentSummaryAndJournalTogether() throws IOException {
        ArtifactHandle handle = store.open(RUN_ID);
        OrchestrationTrace trace = trace(clock.instant(), RunStatus.SUCCEEDED);
        trace.entries().forEach(outcome -> store.appendTrace(handle, outcome));
        assertTrue(Files.isDirectory(root.resolve(FileSystemArtifactStore.STAGING_PREFIX + RUN_ID)));
        assertFalse(Files.exists(root.resolve(RUN_ID)));

        ArtifactReference reference = store.seal(handle, result(trace));

        Path runDir = root.resolve(RUN_ID);
        assertEquals(runDir.toAbsolutePath().normalize().toString(), reference.directory());
        assertFalse(Files.exists(root.resolve(FileSystemArtifactStore.STAGING_PREFIX + RUN_ID)));
        assertEquals(3, Files.readAllLines(runDir.resolve(FileSystemArtifactStore.JOURNAL_FILE)).size());
        assertTrue(Files.readString(runDir.resolve(FileSystemArtifactStore.SUMMARY_FILE))
                .startsWith("# Campaign Run " + RUN_ID));

        JsonNode document = objectMapper.readTree(runDir.resolve(FileSystemArtifactStore.DOCUMENT_FILE).toFile());
        assertEquals(RUN_ID, document.path("run_id").asText());
        assertEquals("2025-03-01T10:00:00Z", document.path("created_at").asText());
        assertEquals("cafe-sol", document.path("input").path("brand").asText());
        assertFalse(document.path("input").path("include_text").asBoolean());
        assertEquals("design", document.path("worker_plan").path("sequence").get(0).asText());
        assertEquals("fallback", document.path("worker_plan").path("mode").asText());
        assertEquals(5, document.path("worker_plan").path("workers").size());
        assertEquals(3, document.path("orchestration_trace").size());
        assertEquals("skipped", document.path("orchestration_trace").get(0).path("status").asText());
        assertEquals("fallback", document.path("input_translation").path("mode").asText());
        assertEquals("SUCCEEDED", document.path("result").path("status").asText());
        assertEquals(850, document.path("result").path("duration_ms").asLong());
        assertEquals(1, document.path("result").path("generated").asLong());
        assertTrue(handle.isSealed());
    }

    @Test
    void resealIsIdempotentAndJournalIsFrozen() throws IOException {
        ArtifactHandle handle = store.open(RUN_ID);
        OrchestrationTrace trace = trace(clock.instant(), RunStatus.DEGRADED);
        store.appendTrace(handle, trace.entries().get(0));
        ArtifactReference first = store.seal(handle, result(trace));
        byte[] document = Files.readAllBytes(Path.of(first.document()));

        clock.advance(Duration.ofMinutes(5));
        ArtifactReference second = store.seal(handle, result(trace));

        assertEquals(first, second);
        assertArrayEquals(document, Files.readAllBytes(Path.of(second.document())));
        assertThrows(IllegalStateException.class, () -> store.appendTrace(handle, trace.entries().get(1)));
        assertEquals(1, Files.readAllLines(root.resolve(RUN_ID).resolve(FileSystemArtifactStore.JOURNAL_FILE)).size());
    }

    @Test
    void reopeningASealedRunReturnsASealedHandle() {
        ArtifactHandle handle = store.open(RUN_ID);
        ArtifactReference reference = store.seal(handle, result(trace(clock.instant(), RunStatus.SUCCEEDED)));

        ArtifactHandle reopened = store.open(RUN_ID);

        assertTrue(reopened.isSealed());
        assertEquals(reference, store.seal(reopened, result(trace(clock.instant(), RunStatus.FAILED))));
        assertEquals(reference, store.find(RUN_ID).orElseThrow());
    }

    @Test
    void closingWithoutSealDiscardsTheStagingArea() throws Exception {
        ArtifactHandle handle = store.open(RUN_ID);
        store.appendTrace(handle, WorkerOutcome.skipped(WorkerName.RESEARCH, "x", clock.instant()));

        handle.close();

        assertFalse(Files.exists(root.resolve(FileSystemArtifactStore.STAGING_PREFIX + RUN_ID)));
        assertFalse(Files.exists(root.resolve(RUN_ID)));
        assertTrue(store.find(RUN_ID).isEmpty());
        assertThrows(IllegalStateException.class,
                () -> store.appendTrace(handle, WorkerOutcome.skipped(WorkerName.COPY, "y", clock.instant())));
    }

    @Test
    void closingASealedHandleKeepsTheArtifact() throws Exception {
        ArtifactHandle handle = store.open(RUN_ID);
        store.seal(handle, result(trace(clock.instant(), RunStatus.SUCCEEDED)));

        handle.close();

        assertTrue(store.find(RUN_ID).isPresent());
    }

    @Test
    void rejectsConcurrentOpenAndInvalidIds() {
        store.open(RUN_ID);

        assertThrows(ArtifactStoreException.class, () -> store.open(RUN_ID));
        assertThrows(ArtifactStoreException.class, () -> store.open("../escape"));
        assertThrows(ArtifactStoreException.class, () -> store.open(""));
        assertTrue(store.find("../escape").isEmpty());
    }

    @Test
    void concurrentRunsKeepCompleteOrderedJournals() throws Exception {
        int runs = 6;
        int entries = 40;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(runs);
        try {
            List<Future<?>> writers = new ArrayList<>();
            for (int r = 0; r < runs; r++) {
                String runId = "run-20250301-100000-00000" + r;
                writers.add(pool.submit(() -> {
                    start.await(5, TimeUnit.SECONDS);
                    ArtifactHandle handle = store.open(runId);
                    for (int i = 0; i < entries; i++) {
                        store.appendTrace(handle, WorkerOutcome.succeeded(WorkerName.GENERATE, null,
                                runId + " entry " + i, i + 1, 0.0, clock.instant()));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> writer : writers) {
                writer.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        for (int r = 0; r < runs; r++) {
            String runId = "run-20250301-100000-00000" + r;
            List<String> lines = Files.readAllLines(root.resolve(FileSystemArtifactStore.STAGING_PREFIX + runId)
                    .resolve(FileSystemArtifactStore.JOURNAL_FILE));
            assertEquals(entries, lines.size(), runId);
            for (int i = 0; i < entries; i++) {
                JsonNode entry = objectMapper.readTree(lines.get(i));
                assertEquals(runId + " entry " + i, entry.path("message").asText());
                assertEquals(i + 1, entry.path("attempt").asInt());
            }
        }
    }
}
