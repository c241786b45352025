package com.example.datalake.mnemo.search;

import com.example.datalake.mnemo.model.EntityType;

public record KnowledgeQuery(long ownerId, EntityType type, String text, int limit) {
}
