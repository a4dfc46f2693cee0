package com.cmagents.api;

public record ClearHistoryResponse(
        String sessionId,
        int cleared
) {
}
