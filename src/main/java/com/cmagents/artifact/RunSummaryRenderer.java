package com.cmagents.artifact;

import com.cmagents.orchestration.model.OutcomeStatus;
import com.cmagents.orchestration.model.RunResult;
import com.cmagents.orchestration.model.WorkerName;
import com.cmagents.orchestration.model.WorkerOutcome;
import com.cmagents.orchestration.model.WorkerStep;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Renders the human-readable {@code report.md} of a run.
 */
@Component
public class RunSummaryRenderer {

    public String render(RunResult result) {
        StringBuilder report = new StringBuilder();
        report.append("# Campaign Run ").append(result.runId()).append("\n\n");
        report.append("- Brand: ").append(result.request().brandId()).append('\n');
        if (result.request().campaignId() != null) {
            report.append("- Campaign: ").append(result.request().campaignId()).append('\n');
        }
        report.append("- Products: ")
                .append(result.request().productIds().isEmpty() ? "auto" : String.join(", ", result.request().productIds()))
                .append('\n');
        report.append("- Objective: ").append(result.request().objective()).append('\n');
        report.append("- Days: ").append(result.request().days()).append('\n');
        report.append("- Build executed: ").append(result.request().build()).append('\n');
        report.append("- Status: ").append(result.status()).append('\n');
        report.append("- Cost: $").append(String.format(Locale.ROOT, "%.4f", result.totalCostUsd())).append('\n');
        report.append("- Duration: ").append(result.duration().toMillis()).append(" ms\n\n");

        report.append("## Worker Plan\n\n");
        report.append("- Mode: ").append(result.plan().mode().label()).append('\n');
        report.append("- Reason: ").append(result.plan().reason()).append('\n');
        report.append("- Sequence: ").append(String.join(" -> ", result.plan().sequence())).append("\n\n");
        report.append("| Worker | Run | Reason |\n|---|---|---|\n");
        for (WorkerStep step : result.plan().steps()) {
            report.append("| ").append(step.name().key())
                    .append(" | ").append(step.willRun() ? "yes" : "no")
                    .append(" | ").append(escape(step.reason()))
                    .append(" |\n");
        }

        report.append("\n## Trace\n\n");
        int index = 1;
        for (WorkerOutcome outcome : result.trace().entries()) {
            report.append(index++).append(". ")
                    .append(outcome.step().key())
                    .append(" ").append(outcome.status().name().toLowerCase(Locale.ROOT));
            if (outcome.attempt() > 0) {
                report.append(" (attempt ").append(outcome.attempt()).append(')');
            }
            if (!outcome.message().isEmpty()) {
                report.append(": ").append(outcome.message().replace('\n', ' '));
            }
            report.append('\n');
        }

        report.append("\n## Result\n\n");
        report.append("- Generated: ").append(result.generatedCount()).append('\n');
        report.append("- QA rejections: ")
                .append(result.trace().count(WorkerName.QA, OutcomeStatus.REJECTED))
                .append('\n');
        report.append("- Errors: ").append(result.errorCount()).append('\n');
        if (result.translation() != null) {
            report.append("\n## Input Translation\n\n");
            report.append("- Mode: ").append(result.translation().mode()).append('\n');
            report.append("- Reason: ").append(result.translation().reason()).append('\n');
        }
        return report.toString();
    }

    private String escape(String value) {
        return value.replace("|", "\\|").replace('\n', ' ');
    }
}
