package com.example.datalake.mnemo.request;

import com.example.datalake.mnemo.model.KnowledgeMetadata;

/**
 * Either field may be omitted; omitted fields stay as they are.
 */
public record KnowledgeUpdateRequest(
        String content,
        KnowledgeMetadata metadata
) {
}
