package com.cmagents.workers;

import com.cmagents.orchestration.model.WorkerName;
import com.cmagents.orchestration.worker.CampaignWorker;
import com.cmagents.orchestration.worker.WorkerContext;
import com.cmagents.orchestration.worker.WorkerResult;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Assembles one render spec per designed item. QA feedback from earlier attempts is
 * folded into every prompt.
 */
@Component
public class GenerateWorker implements CampaignWorker {

    @Override
    public WorkerName name() {
        return WorkerName.GENERATE;
    }

    @Override
    public WorkerResult run(WorkerContext context) {
        DesignDirection design = context.output(WorkerName.DESIGN, DesignDirection.class);
        if (design == null) {
            String style = DesignWorker.selectStyle(context);
            design = new DesignDirection(style, DesignWorker.visualDirection(style),
                    CampaignInputs.blankItems(context).stream().map(item -> item.withStyle(style)).toList());
        }
        boolean includeText = context.request().includeText();
        String brand = CampaignInputs.brandName(context);
        DesignDirection direction = design;
        List<RenderSpec> renders = design.items().stream()
                .map(item -> new RenderSpec(item, includeText,
                        prompt(brand, item, direction.visualDirection(), includeText, context.qaFeedback()),
                        context.attempt()))
                .toList();
        return WorkerResult.ok(new GenerationBatch(design.selectedStyle(), renders, context.attempt()));
    }

    static String prompt(String brand, CampaignItem item, String visualDirection, boolean includeText,
                         List<String> feedback) {
        StringBuilder prompt = new StringBuilder()
                .append("Social ").append(item.size()).append(" image for ").append(brand)
                .append(", product ").append(item.product())
                .append(", day ").append(item.day()).append(" (").append(item.theme()).append("). ")
                .append(visualDirection);
        if (includeText && !item.headline().isBlank()) {
            prompt.append(" Headline: \"").append(item.headline()).append("\".");
            if (!item.subheadline().isBlank()) {
                prompt.append(" Subheadline: \"").append(item.subheadline()).append("\".");
            }
        } else if (!includeText) {
            prompt.append(" No text, letters or logos in the image.");
        }
        if (!feedback.isEmpty()) {
            prompt.append(" Address previous review: ").append(String.join("; ", feedback)).append('.');
        }
        return prompt.toString();
    }
}
