package com.example.datalake.mnemo.model;

/**
 * One nearest-neighbour hit, distance already adjusted by any recency factor.
 */
public record SimilarEmbedding(
        long embeddingId,
        String sourceType,
        Long sourceId,
        String contentText,
        double distance
) {
}
