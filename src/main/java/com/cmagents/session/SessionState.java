package com.cmagents.session;

public enum SessionState {
    CREATED,
    ACTIVE,
    IDLE,
    EVICTED,
    CLOSED;

    public boolean terminal() {
        return this == EVICTED || this == CLOSED;
    }
}
