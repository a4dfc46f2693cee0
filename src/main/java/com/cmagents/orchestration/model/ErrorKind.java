package com.cmagents.orchestration.model;

public enum ErrorKind {
    TRANSIENT,
    FATAL,
    CANCELLED
}
