package com.cmagents.api;

import com.cmagents.session.ChatMessage;

import java.util.List;

public record ChatHistoryResponse(
        String sessionId,
        List<ChatMessage> messages
) {
}
