package com.example.datalake.mnemo.model;

import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;

/**
 * Provenance row of a generated vector. The vector itself lives in the vector index.
 */
@Value
@Builder
public class EmbeddingRecord {

    Long id;

    long ownerId;

    String sourceType;

    Long sourceId;

    String contentText;

    String modelName;

    OffsetDateTime createdAt;
}
