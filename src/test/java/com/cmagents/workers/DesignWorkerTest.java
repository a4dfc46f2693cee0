package com.cmagents.workers;

import com.cmagents.brand.BrandProfile;
import com.cmagents.orchestration.model.ContentRequest;
import com.cmagents.orchestration.model.WorkerName;
import com.cmagents.orchestration.worker.WorkerContext;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DesignWorkerTest {

    private final DesignWorker worker = new DesignWorker();
    private final ContentRequest request = ContentRequest.builder().objective("Promo").brandId("luna").days(2).build();

    @Test
    void usesFirstResearchStyleThatIsNotAvoided() {
        BrandProfile brand = new BrandProfile("luna", "Luna", "beauty", List.of(), List.of("soft_pastel"),
                Map.of(), 0);
        WorkerContext context = WorkerContext.initial("run-1", request, brand.asContext())
                .withOutput(WorkerName.RESEARCH, new TrendBrief("beauty",
                        List.of("soft_pastel", "editorial_studio"), List.of(), "brand_profile"));

        DesignDirection design = (DesignDirection) worker.run(context).payload();

        assertEquals("editorial_studio", design.selectedStyle());
        assertEquals("Studio lighting, editorial framing, refined props.", design.visualDirection());
        assertEquals(2, design.items().size());
        assertTrue(design.items().stream().allMatch(item -> item.style().equals("editorial_studio")));
    }

    @Test
    void stylesCopyItemsWhenPresent() {
        List<CampaignItem> copy = List.of(new CampaignItem(1, "teaser", "luna", "feed", "", "Hello", "World"));
        WorkerContext context = WorkerContext.initial("run-1", request, BrandProfile.unknown("luna").asContext())
                .withOutput(WorkerName.COPY, new CopyBatch(copy));

        DesignDirection design = (DesignDirection) worker.run(context).payload();

        assertEquals(CampaignInputs.DEFAULT_STYLE, design.selectedStyle());
        assertEquals(1, design.items().size());
        assertEquals("Hello", design.items().get(0).headline());
        assertEquals(CampaignInputs.DEFAULT_STYLE, design.items().get(0).style());
    }

    @Test
    void unknownStyleGetsGenericDirection() {
        assertEquals("Follow the neon night style with the product as the clear focal point.",
                DesignWorker.visualDirection("neon_night"));
    }
}
