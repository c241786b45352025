package com.example.datalake.mnemo.response;

import com.example.datalake.mnemo.model.EntityType;
import com.example.datalake.mnemo.model.KnowledgeItem;
import com.example.datalake.mnemo.model.KnowledgeMetadata;

import java.time.OffsetDateTime;

public record KnowledgeItemResponse(
        Long id,
        EntityType type,
        String content,
        KnowledgeMetadata metadata,
        double confidence,
        boolean embedded,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt,
        OffsetDateTime lastReferencedAt
) {

    public static KnowledgeItemResponse from(KnowledgeItem item) {
        return new KnowledgeItemResponse(
                item.getId(),
                item.getEntityType(),
                item.getContent(),
                item.getMetadata(),
                item.getConfidence(),
                item.getEmbeddingId() != null,
                item.getCreatedAt(),
                item.getUpdatedAt(),
                item.getLastReferencedAt());
    }
}
