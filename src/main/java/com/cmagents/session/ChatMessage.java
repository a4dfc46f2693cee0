package com.cmagents.session;

import java.time.Instant;

public record ChatMessage(String role, String content, Instant timestamp) {

    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";

    public static ChatMessage user(String content, Instant at) {
        return new ChatMessage(USER, content, at);
    }

    public static ChatMessage assistant(String content, Instant at) {
        return new ChatMessage(ASSISTANT, content, at);
    }
}
