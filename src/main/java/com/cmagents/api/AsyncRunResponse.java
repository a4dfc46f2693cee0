package com.cmagents.api;

import java.time.Instant;

public record AsyncRunResponse(
        String runId,
        String status,
        Instant acceptedAt
) {
}
