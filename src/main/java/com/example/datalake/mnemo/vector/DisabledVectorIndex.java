package com.example.datalake.mnemo.vector;

import java.util.Collection;
import java.util.List;

public class DisabledVectorIndex implements VectorIndex {

    @Override
    public VectorMode mode() {
        return VectorMode.NONE;
    }

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public void store(long embeddingId, float[] vector) {
        // nothing to index into
    }

    @Override
    public List<VectorMatch> nearestEmbeddings(float[] query, long ownerId, String sourceType, int limit) {
        return List.of();
    }

    @Override
    public List<ChunkMatch> nearestChunks(float[] query, String pathPrefix, int limit) {
        return List.of();
    }

    @Override
    public int remove(Collection<Long> embeddingIds) {
        return 0;
    }
}
