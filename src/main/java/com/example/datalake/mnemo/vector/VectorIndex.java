package com.example.datalake.mnemo.vector;

import java.util.Collection;
import java.util.List;

/**
 * Storage and nearest-neighbour lookup of embedding vectors, keyed by embedding id.
 * Implementations are blocking; callers schedule them off the event loop.
 */
public interface VectorIndex {

    VectorMode mode();

    /**
     * False means similarity search is off for the lifetime of the process and callers must
     * use keyword search instead.
     */
    boolean isAvailable();

    /**
     * Insert or replace the vector for an embedding.
     *
     * @throws com.example.datalake.mnemo.exception.VectorDimensionException if the length differs
     *         from the deployment's dimension
     */
    void store(long embeddingId, float[] vector);

    /**
     * Closest embeddings of one owner, ascending distance.
     *
     * @param sourceType restricts to one source label when not null
     */
    List<VectorMatch> nearestEmbeddings(float[] query, long ownerId, String sourceType, int limit);

    /**
     * Closest file chunks, ascending distance.
     *
     * @param pathPrefix restricts to paths starting with this prefix when not null
     */
    List<ChunkMatch> nearestChunks(float[] query, String pathPrefix, int limit);

    int remove(Collection<Long> embeddingIds);
}
