package com.example.datalake.mnemo.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum GoalStatus {
    ACTIVE("active"),
    COMPLETED("completed"),
    ABANDONED("abandoned");

    private final String code;

    GoalStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static GoalStatus fromCode(String raw) {
        if (raw == null || raw.isBlank()) {
            return ACTIVE;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (GoalStatus status : values()) {
            if (status.code.equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unsupported goal status: " + raw);
    }
}
