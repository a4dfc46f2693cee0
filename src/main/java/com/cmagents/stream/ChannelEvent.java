package com.cmagents.stream;

import java.time.Instant;
import java.util.Map;

/**
 * Outbound envelope of the chat channel: {@code {type, data, timestamp}}.
 */
public record ChannelEvent(String type, Object data, Instant timestamp) {

    public static final String PONG = "pong";
    public static final String CHAT = "chat";
    public static final String ERROR = "error";
    public static final String BUILD_STARTED = "build_started";
    public static final String BUILD_COMPLETED = "build_completed";

    public static ChannelEvent of(String type, Object data, Instant at) {
        return new ChannelEvent(type, data == null ? Map.of() : data, at);
    }

    public static ChannelEvent error(String message, Instant at) {
        return new ChannelEvent(ERROR, Map.of("message", message), at);
    }
}
