package com.cmagents.orchestration.model;

public enum OutcomeStatus {
    SUCCEEDED,
    REJECTED,
    FAILED,
    SKIPPED,
    CANCELLED
}
