package com.cmagents.api;

import java.time.Instant;

public record HealthResponse(
        String status,
        int sessions,
        Instant timestamp
) {
}
