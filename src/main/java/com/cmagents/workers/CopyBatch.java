package com.cmagents.workers;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Copy written for every campaign item, before a style is applied.
 */
public record CopyBatch(
        @JsonProperty("campaign_items") List<CampaignItem> items
) {

    public CopyBatch {
        items = items == null ? List.of() : List.copyOf(items);
    }
}
