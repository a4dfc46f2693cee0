package com.cmagents.workers;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Everything an image backend needs to render one campaign item.
 */
public record RenderSpec(
        @JsonProperty("item") CampaignItem item,
        @JsonProperty("include_text") boolean includeText,
        @JsonProperty("prompt") String prompt,
        @JsonProperty("attempt") int attempt
) {
}
