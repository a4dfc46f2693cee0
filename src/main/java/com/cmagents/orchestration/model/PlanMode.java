package com.cmagents.orchestration.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PlanMode {
    LLM("llm"),
    FALLBACK("fallback"),
    FALLBACK_REPAIRED("fallback-repaired");

    private final String label;

    PlanMode(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
