package com.example.datalake.mnemo.exception;

import com.example.datalake.mnemo.model.EntityType;

/** Raised when an item with the same normalised content already exists for the owner and type. */
public class DuplicateKnowledgeException extends MemoryException {

    private final long ownerId;
    private final EntityType entityType;

    public DuplicateKnowledgeException(long ownerId, EntityType entityType, String content) {
        super("Duplicate %s for owner %d: '%s'".formatted(entityType.code(), ownerId, content));
        this.ownerId = ownerId;
        this.entityType = entityType;
    }

    public long getOwnerId() {
        return ownerId;
    }

    public EntityType getEntityType() {
        return entityType;
    }
}
