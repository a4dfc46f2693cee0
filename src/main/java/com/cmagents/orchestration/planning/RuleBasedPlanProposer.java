package com.cmagents.orchestration.planning;

import com.cmagents.orchestration.api.PlanProposer;
import com.cmagents.orchestration.model.ContentRequest;
import com.cmagents.orchestration.model.PlanSignals;
import com.cmagents.orchestration.model.ProposedStep;
import com.cmagents.orchestration.model.WorkerName;
import com.cmagents.orchestration.model.WorkerStep;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

import static com.cmagents.orchestration.OrchestrationConstants.*;

@Component
public class RuleBasedPlanProposer implements PlanProposer {

    @Override
    public boolean available() {
        return true;
    }

    @Override
    public List<ProposedStep> proposePlan(ContentRequest request, PlanSignals signals) {
        return steps(request, signals).stream()
                .map(step -> new ProposedStep(step.name().key(), step.willRun(), step.reason()))
                .toList();
    }

    public List<WorkerStep> steps(ContentRequest request, PlanSignals signals) {
        return Arrays.stream(WorkerName.values())
                .map(name -> ruleFor(name, request, signals))
                .toList();
    }

    public WorkerStep ruleFor(WorkerName name, ContentRequest request, PlanSignals signals) {
        return switch (name) {
            case RESEARCH -> research(signals);
            case COPY -> wantsText(request, signals)
                    ? WorkerStep.of(name, true, REASON_INCLUDE_TEXT)
                    : WorkerStep.of(name, false, REASON_NO_TEXT);
            case DESIGN, GENERATE -> request.build()
                    ? WorkerStep.of(name, true, REASON_BUILD)
                    : WorkerStep.of(name, false, REASON_NO_BUILD);
            case QA -> request.build() && request.maxRetries() > 0
                    ? WorkerStep.of(name, true, REASON_QA_ENABLED)
                    : WorkerStep.of(name, false, REASON_QA_DISABLED);
        };
    }

    private WorkerStep research(PlanSignals signals) {
        if (signals.trendRequested()) {
            return WorkerStep.of(WorkerName.RESEARCH, true, REASON_TREND_REQUEST);
        }
        if (!signals.styleReferencePresent() && !signals.brandReferencesPresent()) {
            return WorkerStep.of(WorkerName.RESEARCH, true, REASON_MISSING_STYLE_REFERENCES);
        }
        return WorkerStep.of(WorkerName.RESEARCH, false, REASON_STYLE_REFERENCES_AVAILABLE);
    }

    static boolean wantsText(ContentRequest request, PlanSignals signals) {
        return request.includeText() && !signals.noTextRequested();
    }
}
