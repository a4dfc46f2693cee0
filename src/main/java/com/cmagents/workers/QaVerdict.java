package com.cmagents.workers;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record QaVerdict(
        @JsonProperty("ok") boolean ok,
        @JsonProperty("reason") String reason,
        @JsonProperty("details") String details,
        @JsonProperty("issues") List<String> issues
) {

    public static final String REASON_PASSED = "passed";
    public static final String REASON_MISSING_OUTPUT = "missing_output";
    public static final String REASON_INVALID_RENDERS = "invalid_renders";

    public QaVerdict {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }
}
