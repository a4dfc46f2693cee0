package com.cmagents.orchestration.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * The five worker kinds, declared in their fixed execution order.
 */
public enum WorkerName {
    RESEARCH("research"),
    COPY("copy"),
    DESIGN("design"),
    GENERATE("generate"),
    QA("qa");

    private final String key;

    WorkerName(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public int order() {
        return ordinal();
    }

    public static Optional<WorkerName> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        for (WorkerName name : values()) {
            if (name.key.equals(normalized)) {
                return Optional.of(name);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    static WorkerName fromJson(String key) {
        return fromKey(key).orElseThrow(() -> new IllegalArgumentException("Unknown worker: " + key));
    }
}
