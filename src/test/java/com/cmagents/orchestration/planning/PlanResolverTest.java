package com.cmagents.orchestration.planning;

import com.cmagents.orchestration.api.PlanProposer;
import com.cmagents.orchestration.model.ContentRequest;
import com.cmagents.orchestration.model.PlanMode;
import com.cmagents.orchestration.model.PlanSignals;
import com.cmagents.orchestration.model.ProposedStep;
import com.cmagents.orchestration.model.WorkerName;
import com.cmagents.orchestration.model.WorkerPlan;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.cmagents.orchestration.OrchestrationConstants.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PlanResolverTest {

    private static final PlanSignals NO_SIGNALS = new PlanSignals(false, false, false, false);

    private final ExecutorService executor = Executors.newSingleThreadExecutor();
    private final RuleBasedPlanProposer rules = new RuleBasedPlanProposer();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static ContentRequest.ContentRequestBuilder request() {
        return ContentRequest.builder().objective("Launch the spring menu").brandId("cafe-sol");
    }

    private PlanResolver resolver(PlanProposer delegate) {
        return new PlanResolver(rules, delegate, executor, Duration.ofMillis(500));
    }

    private static List<Boolean> runFlags(WorkerPlan plan) {
        return plan.steps().stream().map(step -> step.willRun()).toList();
    }

    @Test
    void usesRulesWhenNoDelegateIsConfigured() {
        WorkerPlan plan = resolver(null).resolve(request().build(true).build(), NO_SIGNALS);

        assertEquals(PlanMode.FALLBACK, plan.mode());
        assertEquals(PLAN_REASON_DELEGATE_UNAVAILABLE, plan.reason());
        assertEquals(List.of("research", "copy", "design", "generate", "qa"), plan.sequence());
        assertEquals(REASON_MISSING_STYLE_REFERENCES, plan.step(WorkerName.RESEARCH).reason());
    }

    @Test
    void neverGeneratesOrReviewsWithoutBuild() {
        for (boolean includeText : new boolean[]{true, false}) {
            for (int retries = 0; retries <= 2; retries++) {
                WorkerPlan plan = resolver(null).resolve(
                        request().build(false).includeText(includeText).maxRetries(retries).build(), NO_SIGNALS);
                assertFalse(plan.willRun(WorkerName.GENERATE));
                assertFalse(plan.willRun(WorkerName.QA));
                assertEquals(REASON_NO_BUILD, plan.step(WorkerName.GENERATE).reason());
            }
        }
    }

    @Test
    void skipsQaWhenNoRetriesAreAllowed() {
        WorkerPlan plan = resolver(null).resolve(request().build(true).maxRetries(0).build(), NO_SIGNALS);

        assertTrue(plan.willRun(WorkerName.GENERATE));
        assertFalse(plan.willRun(WorkerName.QA));
        assertEquals(REASON_QA_DISABLED, plan.step(WorkerName.QA).reason());
    }

    @Test
    void skipsResearchWhenReferencesExistAndNoTrendIsAsked() {
        WorkerPlan plan = resolver(null).resolve(request().build(true).build(),
                new PlanSignals(true, true, false, false));

        assertFalse(plan.willRun(WorkerName.RESEARCH));
        assertEquals(REASON_STYLE_REFERENCES_AVAILABLE, plan.step(WorkerName.RESEARCH).reason());
    }

    @Test
    void trendWordingForcesResearch() {
        WorkerPlan plan = resolver(null).resolve(request().build(true).build(),
                new PlanSignals(true, true, true, false));

        assertTrue(plan.willRun(WorkerName.RESEARCH));
        assertEquals(REASON_TREND_REQUEST, plan.step(WorkerName.RESEARCH).reason());
    }

    @Test
    void noTextWordingSkipsCopyEvenWhenTextIsIncluded() {
        WorkerPlan plan = resolver(null).resolve(request().build(true).includeText(true).build(),
                new PlanSignals(false, false, false, true));

        assertFalse(plan.willRun(WorkerName.COPY));
    }

    @Test
    void imageOnlyBuildWithStyleReference() {
        ContentRequest request = request().build(true).includeText(false).maxRetries(1).styleRefPresent(true).build();

        WorkerPlan plan = resolver(null).resolve(request, new PlanSignals(true, false, false, false));

        assertEquals(List.of(false, false, true, true, true), runFlags(plan));
        assertEquals(List.of("design", "generate", "qa"), plan.sequence());
    }

    @Test
    void acceptsAValidDelegateProposal() {
        PlanProposer delegate = mock(PlanProposer.class);
        when(delegate.available()).thenReturn(true);
        when(delegate.proposePlan(any(), any())).thenReturn(List.of(
                new ProposedStep("research", false, "brand already has references"),
                new ProposedStep("copy", true, "needs headlines"),
                new ProposedStep("design", true, "layout"),
                new ProposedStep("generate", true, "build requested"),
                new ProposedStep("qa", true, "review output")));

        WorkerPlan plan = resolver(delegate).resolve(request().build(true).build(), NO_SIGNALS);

        assertEquals(PlanMode.LLM, plan.mode());
        assertEquals(PLAN_REASON_DELEGATE_ACCEPTED, plan.reason());
        assertEquals(List.of("copy", "design", "generate", "qa"), plan.sequence());
        assertEquals("brand already has references", plan.step(WorkerName.RESEARCH).reason());
    }

    @Test
    void repairsStepsThatViolateTheRequest() {
        PlanProposer delegate = mock(PlanProposer.class);
        when(delegate.available()).thenReturn(true);
        when(delegate.proposePlan(any(), any())).thenReturn(List.of(
                new ProposedStep("research", true, "look for trends"),
                new ProposedStep("copy", true, "write headlines"),
                new ProposedStep("design", true, "layout"),
                new ProposedStep("generate", true, "render"),
                new ProposedStep("qa", true, "review")));

        WorkerPlan plan = resolver(delegate).resolve(
                request().build(false).includeText(false).build(), NO_SIGNALS);

        assertEquals(PlanMode.FALLBACK_REPAIRED, plan.mode());
        assertTrue(plan.reason().startsWith(PLAN_REASON_DELEGATE_REPAIRED));
        assertTrue(plan.reason().contains("copy violates include_text=false"));
        assertTrue(plan.reason().contains("generate violates build=false"));
        assertTrue(plan.reason().contains("qa violates build=false"));
        assertFalse(plan.willRun(WorkerName.COPY));
        assertFalse(plan.willRun(WorkerName.GENERATE));
        assertFalse(plan.willRun(WorkerName.QA));
        assertTrue(plan.willRun(WorkerName.RESEARCH));
        assertEquals("look for trends", plan.step(WorkerName.RESEARCH).reason());
    }

    @Test
    void fillsMissingUnknownAndMisorderedSteps() {
        PlanProposer delegate = mock(PlanProposer.class);
        when(delegate.available()).thenReturn(true);
        when(delegate.proposePlan(any(), any())).thenReturn(List.of(
                new ProposedStep("copy", true, "write"),
                new ProposedStep("research", true, "late"),
                new ProposedStep("publisher", true, "not a worker"),
                new ProposedStep("generate", true, "render"),
                new ProposedStep("generate", true, "again"),
                new ProposedStep("qa", null, "unsure")));

        WorkerPlan plan = resolver(delegate).resolve(request().build(true).build(), NO_SIGNALS);

        assertEquals(PlanMode.FALLBACK_REPAIRED, plan.mode());
        assertTrue(plan.reason().contains("research out of order"));
        assertTrue(plan.reason().contains("unknown worker publisher"));
        assertTrue(plan.reason().contains("generate duplicated"));
        assertTrue(plan.reason().contains("qa without run flag"));
        assertTrue(plan.reason().contains("design missing"));
        assertFalse(plan.reason().contains("research missing"));
        assertEquals(List.of("research", "copy", "design", "generate", "qa"), plan.sequence());
        assertEquals(REASON_BUILD, plan.step(WorkerName.DESIGN).reason());
    }

    @Test
    void fallsBackWhenTheDelegateFails() {
        PlanProposer delegate = mock(PlanProposer.class);
        when(delegate.available()).thenReturn(true);
        when(delegate.proposePlan(any(), any())).thenThrow(new PlanningDelegateException("model unreachable"));

        WorkerPlan plan = resolver(delegate).resolve(request().build(true).build(), NO_SIGNALS);

        assertEquals(PlanMode.FALLBACK, plan.mode());
        assertEquals(PLAN_REASON_DELEGATE_FAILED + "model unreachable", plan.reason());
    }

    @Test
    void fallsBackWhenTheDelegateIsTooSlow() {
        PlanProposer delegate = mock(PlanProposer.class);
        when(delegate.available()).thenReturn(true);
        when(delegate.proposePlan(any(), any())).thenAnswer(invocation -> {
            Thread.sleep(5_000);
            return List.of();
        });
        PlanResolver resolver = new PlanResolver(rules, delegate, executor, Duration.ofMillis(50));

        WorkerPlan plan = resolver.resolve(request().build(true).build(), NO_SIGNALS);

        assertEquals(PlanMode.FALLBACK, plan.mode());
        assertTrue(plan.reason().startsWith(PLAN_REASON_DELEGATE_FAILED + "timed out"));
    }

    @Test
    void skipsAnUnavailableDelegate() {
        PlanProposer delegate = mock(PlanProposer.class);
        when(delegate.available()).thenReturn(false);

        WorkerPlan plan = resolver(delegate).resolve(request().build(true).build(), NO_SIGNALS);

        assertEquals(PlanMode.FALLBACK, plan.mode());
        verify(delegate, never()).proposePlan(any(), any());
    }
}
