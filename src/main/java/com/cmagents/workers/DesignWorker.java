package com.cmagents.workers;

import com.cmagents.orchestration.model.WorkerName;
import com.cmagents.orchestration.worker.CampaignWorker;
import com.cmagents.orchestration.worker.WorkerContext;
import com.cmagents.orchestration.worker.WorkerResult;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Picks the campaign style and applies it to every item.
 */
@Component
public class DesignWorker implements CampaignWorker {

    private static final Map<String, String> VISUAL_DIRECTIONS = Map.of(
            "minimal_clean", "Clean background, generous negative space, soft even light, product centered.",
            "warm_lifestyle", "Natural daylight, warm tones, lived-in setting around the product.",
            "bold_color_pop", "Saturated flat background, hard shadows, strong color contrast.",
            "editorial_studio", "Studio lighting, editorial framing, refined props.",
            "soft_pastel", "Pastel palette, diffused light, gentle gradients.",
            "dark_premium", "Dark backdrop, rim lighting, glossy highlights, premium feel.");

    @Override
    public WorkerName name() {
        return WorkerName.DESIGN;
    }

    @Override
    public WorkerResult run(WorkerContext context) {
        String style = selectStyle(context);
        CopyBatch copy = context.output(WorkerName.COPY, CopyBatch.class);
        List<CampaignItem> items = copy != null ? copy.items() : CampaignInputs.blankItems(context);
        List<CampaignItem> styled = items.stream().map(item -> item.withStyle(style)).toList();
        return WorkerResult.ok(new DesignDirection(style, visualDirection(style), styled));
    }

    static String selectStyle(WorkerContext context) {
        TrendBrief trend = context.output(WorkerName.RESEARCH, TrendBrief.class);
        List<String> candidates = trend != null && !trend.recommendedStyles().isEmpty()
                ? trend.recommendedStyles()
                : CampaignInputs.preferredStyles(context);
        List<String> avoid = CampaignInputs.avoidStyles(context);
        return candidates.stream()
                .filter(style -> !avoid.contains(style))
                .findFirst()
                .orElse(CampaignInputs.DEFAULT_STYLE);
    }

    static String visualDirection(String style) {
        return VISUAL_DIRECTIONS.getOrDefault(style, "Follow the " + style.replace('_', ' ')
                + " style with the product as the clear focal point.");
    }
}
