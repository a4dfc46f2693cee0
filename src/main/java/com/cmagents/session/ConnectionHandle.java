package com.cmagents.session;

public record ConnectionHandle(String sessionId, String connectionId) {

    String rateKey() {
        return sessionId + ":" + connectionId;
    }
}
