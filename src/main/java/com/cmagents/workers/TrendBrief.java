package com.cmagents.workers;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record TrendBrief(
        @JsonProperty("industry") String industry,
        @JsonProperty("recommended_styles") List<String> recommendedStyles,
        @JsonProperty("key_insights") List<String> keyInsights,
        @JsonProperty("source_mode") String sourceMode
) {

    public TrendBrief {
        recommendedStyles = recommendedStyles == null ? List.of() : List.copyOf(recommendedStyles);
        keyInsights = keyInsights == null ? List.of() : List.copyOf(keyInsights);
    }
}
