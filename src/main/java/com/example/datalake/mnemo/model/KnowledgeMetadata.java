package com.example.datalake.mnemo.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Typed metadata attached to a knowledge item.
 *
 * <ul>
 *   <li>facts use {@code category} (e.g. "project", "preference")</li>
 *   <li>goals use {@code description} and {@code status}</li>
 *   <li>list items may carry the list name in {@code category}</li>
 * </ul>
 *
 * Anything else goes into {@code extras}. Stored as JSON in {@code knowledge.metadata_json}.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record KnowledgeMetadata(
        String category,
        String description,
        GoalStatus status,
        Map<String, String> extras
) {

    private static final KnowledgeMetadata EMPTY = new KnowledgeMetadata(null, null, null, Map.of());

    public KnowledgeMetadata {
        extras = extras == null ? Map.of() : Map.copyOf(extras);
    }

    public static KnowledgeMetadata empty() {
        return EMPTY;
    }

    public static KnowledgeMetadata fact(String category) {
        return new KnowledgeMetadata(category, null, null, Map.of());
    }

    public static KnowledgeMetadata goal(String description, GoalStatus status) {
        return new KnowledgeMetadata(null, description, status == null ? GoalStatus.ACTIVE : status, Map.of());
    }

    public static KnowledgeMetadata listItem(String listName) {
        return new KnowledgeMetadata(listName, null, null, Map.of());
    }

    /**
     * Goals without an explicit status are active.
     */
    @JsonIgnore
    public GoalStatus effectiveStatus() {
        return status == null ? GoalStatus.ACTIVE : status;
    }

    public KnowledgeMetadata withStatus(GoalStatus newStatus) {
        return new KnowledgeMetadata(category, description, newStatus, extras);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return category == null && description == null && status == null && extras.isEmpty();
    }
}
