package com.cmagents.workers;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record DesignDirection(
        @JsonProperty("selected_style") String selectedStyle,
        @JsonProperty("visual_direction") String visualDirection,
        @JsonProperty("campaign_items") List<CampaignItem> items
) {

    public DesignDirection {
        items = items == null ? List.of() : List.copyOf(items);
    }
}
