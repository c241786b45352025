package com.example.datalake.mnemo.model;

import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;

/**
 * A typed unit of durable memory owned by one user.
 */
@Value
@Builder(toBuilder = true)
public class KnowledgeItem {

    Long id;

    long ownerId;

    EntityType entityType;

    String content;

    @Builder.Default
    KnowledgeMetadata metadata = KnowledgeMetadata.empty();

    /**
     * 0.0 - 1.0, higher means more certain.
     */
    @Builder.Default
    double confidence = 1.0;

    /**
     * Null until the background embedding lands, or forever if it failed.
     */
    Long embeddingId;

    OffsetDateTime createdAt;

    OffsetDateTime updatedAt;

    OffsetDateTime lastReferencedAt;

    public static KnowledgeItem of(EntityType type, String content, KnowledgeMetadata metadata) {
        return KnowledgeItem.builder()
                .entityType(type)
                .content(content)
                .metadata(metadata == null ? KnowledgeMetadata.empty() : metadata)
                .build();
    }
}
