package com.cmagents.orchestration.model;

public enum RunStatus {
    RUNNING,
    SUCCEEDED,
    DEGRADED,
    FAILED,
    CANCELLED;

    public boolean terminal() {
        return this != RUNNING;
    }
}
