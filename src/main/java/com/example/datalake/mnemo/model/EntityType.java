package com.example.datalake.mnemo.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of knowledge item. The code is what gets stored in {@code knowledge.entity_type};
 * {@link #sourceType()} is the label used on the item's embedding rows.
 */
public enum EntityType {
    FACT("fact"),
    GOAL("goal"),
    LIST_ITEM("list_item");

    private final String code;

    EntityType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public String sourceType() {
        return "knowledge_" + code;
    }

    @JsonCreator
    public static EntityType fromCode(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("entity type is required");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (EntityType type : values()) {
            if (type.code.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unsupported entity type: " + raw);
    }
}
