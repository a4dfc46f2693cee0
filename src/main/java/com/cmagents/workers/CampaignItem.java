package com.cmagents.workers;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One planned post: a product on a given day under a campaign theme.
 */
public record CampaignItem(
        @JsonProperty("day") int day,
        @JsonProperty("theme") String theme,
        @JsonProperty("product") String product,
        @JsonProperty("size") String size,
        @JsonProperty("style") String style,
        @JsonProperty("headline") String headline,
        @JsonProperty("subheadline") String subheadline
) {

    public CampaignItem withStyle(String selectedStyle) {
        return new CampaignItem(day, theme, product, size, selectedStyle, headline, subheadline);
    }
}
