package com.cmagents.workers;

import com.cmagents.orchestration.model.WorkerName;
import com.cmagents.orchestration.worker.CampaignWorker;
import com.cmagents.orchestration.worker.WorkerContext;
import com.cmagents.orchestration.worker.WorkerResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Deterministic copy: one item per day and product, rotating through the campaign themes.
 */
@Component
public class CopyWorker implements CampaignWorker {

    @Override
    public WorkerName name() {
        return WorkerName.COPY;
    }

    @Override
    public WorkerResult run(WorkerContext context) {
        String objective = context.request().objective();
        Map<String, String> products = CampaignInputs.products(context);
        List<CampaignItem> items = new ArrayList<>();
        for (int day = 1; day <= context.request().days(); day++) {
            String theme = CampaignInputs.theme(day);
            for (Map.Entry<String, String> product : products.entrySet()) {
                String[] copy = copy(theme, product.getValue(), objective);
                items.add(new CampaignItem(day, theme, product.getKey(), CampaignInputs.DEFAULT_SIZE, "",
                        copy[0], copy[1]));
            }
        }
        return WorkerResult.ok(new CopyBatch(items));
    }

    static String[] copy(String theme, String product, String objective) {
        return switch (theme) {
            case "teaser" -> new String[]{product + " feels different", "A new look is coming soon"};
            case "main_offer" -> new String[]{product + ", star of the day", "A campaign focused on " + objective};
            case "last_chance" -> new String[]{"Last call for " + product, "Closing the campaign on a high note"};
            case "social_proof" -> new String[]{product + ", recommended by the community",
                    "Trust, consistency and results"};
            default -> new String[]{product + " is still trending", "Keep the campaign momentum going"};
        };
    }
}
