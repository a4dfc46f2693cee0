package com.cmagents.orchestration.planning;

import com.cmagents.config.CampaignAgentsProperties;
import com.cmagents.orchestration.api.PlanProposer;
import com.cmagents.orchestration.model.ContentRequest;
import com.cmagents.orchestration.model.PlanMode;
import com.cmagents.orchestration.model.PlanSignals;
import com.cmagents.orchestration.model.ProposedStep;
import com.cmagents.orchestration.model.WorkerName;
import com.cmagents.orchestration.model.WorkerPlan;
import com.cmagents.orchestration.model.WorkerStep;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static com.cmagents.orchestration.OrchestrationConstants.*;

/**
 * Resolves the worker plan of a request. Never fails: delegate proposals are validated
 * step by step and repaired with the rules, and any delegate error falls back to the
 * rules entirely.
 */
@Service
@Slf4j
public class PlanResolver {

    private final RuleBasedPlanProposer rules;
    private final @Nullable PlanProposer delegate;
    private final ExecutorService workerExecutor;
    private final Duration delegateTimeout;

    @Autowired
    public PlanResolver(RuleBasedPlanProposer rules,
                        ObjectProvider<LlmPlanProposer> delegateProvider,
                        @Qualifier("workerExecutor") ExecutorService workerExecutor,
                        CampaignAgentsProperties properties) {
        this(rules, delegateProvider.getIfAvailable(), workerExecutor, properties.getPlanning().getDelegateTimeout());
    }

    public PlanResolver(RuleBasedPlanProposer rules,
                        @Nullable PlanProposer delegate,
                        ExecutorService workerExecutor,
                        Duration delegateTimeout) {
        this.rules = rules;
        this.delegate = delegate;
        this.workerExecutor = workerExecutor;
        this.delegateTimeout = delegateTimeout;
    }

    public WorkerPlan resolve(ContentRequest request, PlanSignals signals) {
        if (delegate == null || !delegate.available()) {
            return fallback(request, signals, PLAN_REASON_DELEGATE_UNAVAILABLE);
        }
        List<ProposedStep> proposal;
        try {
            proposal = propose(request, signals);
        } catch (PlanningDelegateException ex) {
            log.warn("Planning delegate failed, using rules: {}", ex.getMessage());
            return fallback(request, signals, PLAN_REASON_DELEGATE_FAILED + ex.getMessage());
        }
        return repair(proposal, request, signals);
    }

    private WorkerPlan fallback(ContentRequest request, PlanSignals signals, String reason) {
        WorkerPlan plan = new WorkerPlan(rules.steps(request, signals), PlanMode.FALLBACK, reason);
        log.info("Resolved plan {} (mode={}, reason={})", plan.sequence(), plan.mode().label(), reason);
        return plan;
    }

    private List<ProposedStep> propose(ContentRequest request, PlanSignals signals) {
        Future<List<ProposedStep>> future = workerExecutor.submit(() -> delegate.proposePlan(request, signals));
        try {
            List<ProposedStep> proposal = future.get(delegateTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (proposal == null) {
                throw new PlanningDelegateException("delegate returned no plan");
            }
            return proposal;
        } catch (TimeoutException ex) {
            future.cancel(true);
            throw new PlanningDelegateException("timed out after " + delegateTimeout.toMillis() + " ms", ex);
        } catch (InterruptedException ex) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new PlanningDelegateException("interrupted", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            if (cause instanceof PlanningDelegateException delegateException) {
                throw delegateException;
            }
            throw new PlanningDelegateException(String.valueOf(cause.getMessage()), cause);
        } catch (RuntimeException ex) {
            throw new PlanningDelegateException(String.valueOf(ex.getMessage()), ex);
        }
    }

    WorkerPlan repair(List<ProposedStep> proposal, ContentRequest request, PlanSignals signals) {
        Map<WorkerName, ProposedStep> accepted = new EnumMap<>(WorkerName.class);
        List<String> repairs = new ArrayList<>();
        int lastOrder = -1;
        for (ProposedStep proposed : proposal) {
            if (proposed == null) {
                repairs.add("null entry");
                continue;
            }
            Optional<WorkerName> name = WorkerName.fromKey(proposed.name());
            if (name.isEmpty()) {
                repairs.add("unknown worker " + proposed.name());
                continue;
            }
            WorkerName worker = name.get();
            if (accepted.containsKey(worker)) {
                repairs.add(worker.key() + " duplicated");
                continue;
            }
            if (worker.order() <= lastOrder) {
                repairs.add(worker.key() + " out of order");
                continue;
            }
            if (proposed.run() == null) {
                repairs.add(worker.key() + " without run flag");
                continue;
            }
            accepted.put(worker, proposed);
            lastOrder = worker.order();
        }

        List<WorkerStep> steps = new ArrayList<>();
        for (WorkerName worker : WorkerName.values()) {
            WorkerStep rule = rules.ruleFor(worker, request, signals);
            ProposedStep proposed = accepted.get(worker);
            if (proposed == null) {
                if (!repairs.contains(worker.key() + " out of order")
                        && !repairs.contains(worker.key() + " without run flag")) {
                    repairs.add(worker.key() + " missing");
                }
                steps.add(rule);
                continue;
            }
            String violation = violation(worker, proposed.run(), request, signals);
            if (violation != null) {
                repairs.add(worker.key() + " violates " + violation);
                steps.add(rule);
                continue;
            }
            String reason = StringUtils.hasText(proposed.reason()) ? proposed.reason().trim() : "planner decision";
            steps.add(WorkerStep.of(worker, proposed.run(), reason));
        }

        WorkerPlan plan = repairs.isEmpty()
                ? new WorkerPlan(steps, PlanMode.LLM, PLAN_REASON_DELEGATE_ACCEPTED)
                : new WorkerPlan(steps, PlanMode.FALLBACK_REPAIRED,
                        PLAN_REASON_DELEGATE_REPAIRED + String.join(", ", repairs));
        log.info("Resolved plan {} (mode={}, reason={})", plan.sequence(), plan.mode().label(), plan.reason());
        return plan;
    }

    private @Nullable String violation(WorkerName worker, boolean run, ContentRequest request, PlanSignals signals) {
        return switch (worker) {
            case COPY -> run && !RuleBasedPlanProposer.wantsText(request, signals) ? REASON_NO_TEXT : null;
            case GENERATE -> {
                if (run && !request.build()) {
                    yield REASON_NO_BUILD;
                }
                yield !run && request.build() ? REASON_BUILD : null;
            }
            case QA -> {
                if (run && !request.build()) {
                    yield REASON_NO_BUILD;
                }
                yield run && request.maxRetries() <= 0 ? "max_retries=0" : null;
            }
            case RESEARCH, DESIGN -> null;
        };
    }
}
