package com.cmagents.workers;

import com.cmagents.orchestration.model.WorkerName;
import com.cmagents.orchestration.worker.CampaignWorker;
import com.cmagents.orchestration.worker.WorkerContext;
import com.cmagents.orchestration.worker.WorkerResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds a trend brief from the brand's industry, its preferred styles and the objective.
 */
@Component
public class ResearchWorker implements CampaignWorker {

    static final String SOURCE_MODE = "brand_profile";

    private static final Map<String, List<String>> INDUSTRY_STYLES = Map.of(
            "food", List.of("warm_lifestyle", "bold_color_pop"),
            "fashion", List.of("editorial_studio", "minimal_clean"),
            "beauty", List.of("soft_pastel", "minimal_clean"),
            "tech", List.of("dark_premium", "minimal_clean"));

    @Override
    public WorkerName name() {
        return WorkerName.RESEARCH;
    }

    @Override
    public WorkerResult run(WorkerContext context) {
        String industry = CampaignInputs.industry(context);
        LinkedHashSet<String> styles = new LinkedHashSet<>(CampaignInputs.preferredStyles(context));
        if (styles.isEmpty()) {
            styles.addAll(INDUSTRY_STYLES.getOrDefault(industry.toLowerCase(Locale.ROOT), List.of()));
        }
        styles.removeAll(CampaignInputs.avoidStyles(context));
        if (styles.isEmpty()) {
            styles.add(CampaignInputs.DEFAULT_STYLE);
        }

        List<String> insights = new ArrayList<>();
        insights.add("Objective focus: " + context.request().objective());
        insights.add("Keep product fidelity and clear hierarchy.");
        if (context.request().includeText()) {
            insights.add("Prefer high contrast text areas for social formats.");
        } else {
            insights.add("Let the product carry the message without overlaid text.");
        }
        if (!context.request().constraints().isEmpty()) {
            insights.add("Respect constraints: " + context.request().constraints());
        }
        return WorkerResult.ok(new TrendBrief(industry, List.copyOf(styles), insights, SOURCE_MODE));
    }
}
