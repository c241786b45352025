package com.example.datalake.mnemo.dao.converter;

import com.example.datalake.mnemo.model.KnowledgeMetadata;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps {@link KnowledgeMetadata} to and from the {@code knowledge.metadata_json} column.
 */
public class KnowledgeMetadataConverter {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeMetadataConverter.class);

    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public String toColumn(KnowledgeMetadata metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            log.warn("Unable to serialize knowledge metadata, storing as null", e);
            return null;
        }
    }

    public KnowledgeMetadata fromColumn(String json) {
        if (json == null || json.isBlank()) {
            return KnowledgeMetadata.empty();
        }
        try {
            return objectMapper.readValue(json, KnowledgeMetadata.class);
        } catch (JsonProcessingException e) {
            log.warn("Unable to deserialize knowledge metadata JSON, returning empty metadata", e);
            return KnowledgeMetadata.empty();
        }
    }
}
