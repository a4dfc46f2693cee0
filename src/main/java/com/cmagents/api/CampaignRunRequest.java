package com.cmagents.api;

import com.cmagents.orchestration.model.ContentRequest;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

import java.util.List;

public record CampaignRunRequest(
        @NotBlank String objective,
        @NotBlank String brandId,
        String campaignId,
        @Min(ContentRequest.MIN_DAYS) @Max(ContentRequest.MAX_DAYS) Integer days,
        Boolean build,
        Boolean includeText,
        boolean styleRefPresent,
        @Min(0) Integer maxRetries,
        String constraints,
        List<String> productIds
) {

    public ContentRequest toContentRequest(int defaultMaxRetries) {
        return ContentRequest.builder()
                .objective(objective)
                .brandId(brandId)
                .campaignId(campaignId)
                .days(days != null ? days : 3)
                .build(build == null || build)
                .includeText(includeText == null || includeText)
                .styleRefPresent(styleRefPresent)
                .maxRetries(maxRetries != null ? maxRetries : defaultMaxRetries)
                .constraints(constraints)
                .productIds(productIds)
                .build();
    }
}
