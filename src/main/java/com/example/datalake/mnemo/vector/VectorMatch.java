package com.example.datalake.mnemo.vector;

import java.time.OffsetDateTime;

/**
 * Raw nearest-neighbour candidate. {@code lastReferencedAt} comes from the owning knowledge
 * row in the same query and is null for file chunks or items never surfaced.
 */
public record VectorMatch(
        long embeddingId,
        String sourceType,
        Long sourceId,
        String contentText,
        double distance,
        OffsetDateTime lastReferencedAt
) {

    public VectorMatch withDistance(double adjusted) {
        return new VectorMatch(embeddingId, sourceType, sourceId, contentText, adjusted, lastReferencedAt);
    }
}
