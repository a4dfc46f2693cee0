package com.cmagents.orchestration.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * How a free-text chat request was turned into run parameters.
 */
public record InputTranslation(
        String objective,
        int days,
        boolean build,
        @JsonProperty("include_text") boolean includeText,
        List<String> products,
        String reason,
        String mode
) {

    public InputTranslation {
        products = products == null ? List.of() : List.copyOf(products);
    }

    public ContentRequest toRequest(String brandId, int maxRetries, boolean styleRefPresent) {
        return ContentRequest.builder()
                .objective(objective)
                .brandId(brandId)
                .days(days)
                .build(build)
                .includeText(includeText)
                .styleRefPresent(styleRefPresent)
                .maxRetries(maxRetries)
                .productIds(products)
                .build();
    }
}
