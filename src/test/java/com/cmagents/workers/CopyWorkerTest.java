package com.cmagents.workers;

import com.cmagents.brand.BrandProfile;
import com.cmagents.orchestration.model.ContentRequest;
import com.cmagents.orchestration.worker.WorkerContext;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CopyWorkerTest {

    private final CopyWorker worker = new CopyWorker();

    private static BrandProfile brand() {
        Map<String, String> products = new LinkedHashMap<>();
        products.put("latte", "Oat Latte");
        products.put("cake", "Carrot Cake");
        return new BrandProfile("cafe", "Cafe Sol", "food", List.of(), List.of(), products, 2);
    }

    @Test
    void writesOneItemPerDayAndProductRotatingThemes() {
        ContentRequest request = ContentRequest.builder().objective("Weekend promo").brandId("cafe").days(6).build();

        List<CampaignItem> items = ((CopyBatch) worker.run(
                WorkerContext.initial("run-1", request, brand().asContext())).payload()).items();

        assertEquals(12, items.size());
        assertEquals("teaser", items.get(0).theme());
        assertEquals("latte", items.get(0).product());
        assertEquals("Oat Latte feels different", items.get(0).headline());
        assertEquals("cake", items.get(1).product());
        assertEquals("main_offer", items.get(2).theme());
        assertEquals("A campaign focused on Weekend promo", items.get(2).subheadline());
        assertEquals("teaser", items.get(10).theme());
        assertTrue(items.stream().allMatch(item -> item.style().isEmpty()));
    }

    @Test
    void requestedProductsNarrowTheCatalog() {
        ContentRequest request = ContentRequest.builder().objective("Promo").brandId("cafe").days(1)
                .productIds(List.of("cake", "muffin")).build();

        List<CampaignItem> items = ((CopyBatch) worker.run(
                WorkerContext.initial("run-1", request, brand().asContext())).payload()).items();

        assertEquals(List.of("cake", "muffin"), items.stream().map(CampaignItem::product).toList());
        assertEquals("muffin feels different", items.get(1).headline());
    }

    @Test
    void emptyCatalogUsesTheBrandItself() {
        ContentRequest request = ContentRequest.builder().objective("Promo").brandId("acme").days(1).build();

        List<CampaignItem> items = ((CopyBatch) worker.run(
                WorkerContext.initial("run-1", request, BrandProfile.unknown("acme").asContext())).payload()).items();

        assertEquals(1, items.size());
        assertEquals("acme", items.get(0).product());
    }
}
