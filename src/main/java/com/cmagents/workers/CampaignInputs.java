package com.cmagents.workers;

import com.cmagents.brand.BrandProfile;
import com.cmagents.orchestration.model.ContentRequest;
import com.cmagents.orchestration.worker.WorkerContext;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the brand configuration handed to workers and derives the item grid of a campaign.
 */
final class CampaignInputs {

    static final String DEFAULT_STYLE = "minimal_clean";
    static final String DEFAULT_SIZE = "feed";
    static final List<String> THEMES = List.of("teaser", "main_offer", "last_chance", "social_proof", "reminder");

    private CampaignInputs() {
    }

    static String industry(WorkerContext context) {
        Object industry = context.brandContext().get(BrandProfile.KEY_INDUSTRY);
        return industry instanceof String value && !value.isBlank() ? value : "generic";
    }

    static String brandName(WorkerContext context) {
        Object name = context.brandContext().get(BrandProfile.KEY_NAME);
        return name instanceof String value && !value.isBlank() ? value : context.request().brandId();
    }

    static List<String> preferredStyles(WorkerContext context) {
        return strings(context.brandContext().get(BrandProfile.KEY_PREFERRED_STYLES));
    }

    static List<String> avoidStyles(WorkerContext context) {
        return strings(context.brandContext().get(BrandProfile.KEY_AVOID_STYLES));
    }

    /**
     * Products of the campaign, id to display name. Requested products are kept even when
     * the catalog does not know them; an empty selection means the whole catalog, or the
     * brand itself when the catalog is empty.
     */
    static Map<String, String> products(WorkerContext context) {
        Map<String, String> catalog = new LinkedHashMap<>();
        Object raw = context.brandContext().get(BrandProfile.KEY_PRODUCTS);
        if (raw instanceof Map<?, ?> map) {
            map.forEach((id, name) -> catalog.put(String.valueOf(id), String.valueOf(name)));
        }
        List<String> requested = context.request().productIds();
        if (!requested.isEmpty()) {
            Map<String, String> selected = new LinkedHashMap<>();
            requested.forEach(id -> selected.put(id, catalog.getOrDefault(id, id)));
            return selected;
        }
        if (catalog.isEmpty()) {
            catalog.put(context.request().brandId(), brandName(context));
        }
        return catalog;
    }

    static String theme(int day) {
        return THEMES.get((day - 1) % THEMES.size());
    }

    /**
     * Item grid without copy: one entry per day and product.
     */
    static List<CampaignItem> blankItems(WorkerContext context) {
        ContentRequest request = context.request();
        List<CampaignItem> items = new ArrayList<>();
        for (int day = 1; day <= request.days(); day++) {
            String theme = theme(day);
            for (String product : products(context).keySet()) {
                items.add(new CampaignItem(day, theme, product, DEFAULT_SIZE, "", "", ""));
            }
        }
        return items;
    }

    private static List<String> strings(Object raw) {
        if (!(raw instanceof List<?> list)) {
            return List.of();
        }
        return list.stream().map(String::valueOf).filter(value -> !value.isBlank()).toList();
    }
}
