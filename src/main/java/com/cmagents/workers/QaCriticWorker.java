package com.cmagents.workers;

import com.cmagents.orchestration.model.WorkerName;
import com.cmagents.orchestration.worker.CampaignWorker;
import com.cmagents.orchestration.worker.WorkerContext;
import com.cmagents.orchestration.worker.WorkerResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Reviews the generated render specs. A rejection carries one feedback line per issue,
 * which the next generate attempt receives.
 */
@Component
public class QaCriticWorker implements CampaignWorker {

    @Override
    public WorkerName name() {
        return WorkerName.QA;
    }

    @Override
    public WorkerResult run(WorkerContext context) {
        GenerationBatch batch = context.output(WorkerName.GENERATE, GenerationBatch.class);
        if (batch == null || batch.renders().isEmpty()) {
            QaVerdict verdict = new QaVerdict(false, QaVerdict.REASON_MISSING_OUTPUT,
                    "Nothing was generated to review.", List.of("generate produced no renders"));
            return WorkerResult.rejected(verdict, verdict.issues());
        }
        List<String> issues = review(batch);
        if (!issues.isEmpty()) {
            long failing = batch.renders().stream().filter(render -> !review(render).isEmpty()).count();
            QaVerdict verdict = new QaVerdict(false, QaVerdict.REASON_INVALID_RENDERS,
                    failing + " of " + batch.renders().size() + " renders need changes.", issues);
            return WorkerResult.rejected(verdict, issues);
        }
        return WorkerResult.ok(new QaVerdict(true, QaVerdict.REASON_PASSED,
                batch.renders().size() + " renders look valid.", List.of()));
    }

    static List<String> review(GenerationBatch batch) {
        List<String> issues = new ArrayList<>();
        batch.renders().forEach(render -> issues.addAll(review(render)));
        return issues;
    }

    static List<String> review(RenderSpec render) {
        List<String> issues = new ArrayList<>();
        CampaignItem item = render.item();
        String label = "day " + item.day() + " " + item.product();
        if (render.prompt() == null || render.prompt().isBlank()) {
            issues.add(label + ": empty prompt");
        }
        if (render.includeText() && item.headline().isBlank()) {
            issues.add(label + ": missing headline");
        }
        if (item.style() == null || item.style().isBlank()) {
            issues.add(label + ": no style applied");
        }
        return issues;
    }
}
