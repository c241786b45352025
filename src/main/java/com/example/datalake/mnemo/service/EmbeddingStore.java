package com.example.datalake.mnemo.service;

import com.example.datalake.mnemo.config.MnemoProperties;
import com.example.datalake.mnemo.dao.EmbeddingDao;
import com.example.datalake.mnemo.embedding.VectorEncoder;
import com.example.datalake.mnemo.model.EmbeddingRecord;
import com.example.datalake.mnemo.model.SimilarEmbedding;
import com.example.datalake.mnemo.vector.ChunkMatch;
import com.example.datalake.mnemo.vector.RecencyBoost;
import com.example.datalake.mnemo.vector.VectorIndex;
import com.example.datalake.mnemo.vector.VectorMatch;
import com.example.datalake.mnemo.vector.VectorMode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.List;

/**
 * Persists embeddings and answers nearest-neighbour queries.
 *
 * <p>The {@code embeddings} row is the durable record; the vector index is secondary and a
 * failed index write only costs similarity recall for that row.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EmbeddingStore {

    private final VectorEncoder encoder;
    private final EmbeddingDao embeddingDao;
    private final VectorIndex vectorIndex;
    private final RecencyBoost recencyBoost;
    private final MnemoProperties properties;

    public boolean isVectorSearchAvailable() {
        return vectorIndex.isAvailable();
    }

    public VectorMode vectorMode() {
        return vectorIndex.mode();
    }

    /**
     * Embeds {@code text} and stores it.
     *
     * @param sourceId owning row, null for file chunks
     * @return id of the new embedding row
     */
    public Mono<Long> upsertEmbedding(long ownerId, String sourceType, Long sourceId, String text) {
        return encoder.embed(text)
                .publishOn(Schedulers.boundedElastic())
                .map(vector -> persist(ownerId, sourceType, sourceId, text, vector));
    }

    public Mono<List<SimilarEmbedding>> searchSimilar(long ownerId, String query, int limit) {
        return searchSimilarForType(ownerId, query, null, limit, false);
    }

    /**
     * Nearest embeddings of one owner, ascending distance. Empty when the vector index is off
     * or the lookup fails.
     *
     * @param sourceType restricts to one source label when not null
     * @param recencyBoost re-rank toward knowledge referenced recently
     */
    public Mono<List<SimilarEmbedding>> searchSimilarForType(long ownerId,
                                                              String query,
                                                              String sourceType,
                                                              int limit,
                                                              boolean recencyBoost) {
        if (!vectorIndex.isAvailable() || limit <= 0 || query == null || query.isBlank()) {
            return Mono.just(List.of());
        }
        int fetch = recencyBoost ? limit * properties.getVector().getOverFetchFactor() : limit;

        return encoder.embed(query)
                .publishOn(Schedulers.boundedElastic())
                .map(vector -> vectorIndex.nearestEmbeddings(vector, ownerId, sourceType, fetch))
                .map(matches -> recencyBoost ? this.recencyBoost.apply(matches, limit) : matches)
                .map(matches -> matches.stream().map(EmbeddingStore::toSimilar).toList())
                .onErrorResume(e -> {
                    log.warn("[embedding-store] Similarity search failed for owner {} – {}", ownerId, e.getMessage());
                    return Mono.just(List.of());
                });
    }

    /**
     * Nearest file chunks, ascending distance.
     */
    public Mono<List<ChunkMatch>> searchChunks(String query, String pathPrefix, int limit) {
        if (!vectorIndex.isAvailable() || limit <= 0 || query == null || query.isBlank()) {
            return Mono.just(List.of());
        }
        return encoder.embed(query)
                .publishOn(Schedulers.boundedElastic())
                .map(vector -> vectorIndex.nearestChunks(vector, pathPrefix, limit))
                .onErrorResume(e -> {
                    log.warn("[embedding-store] Chunk similarity search failed – {}", e.getMessage());
                    return Mono.just(List.of());
                });
    }

    /**
     * Drops embedding rows together with their vectors.
     */
    public Mono<Integer> remove(Collection<Long> embeddingIds) {
        if (embeddingIds == null || embeddingIds.isEmpty()) {
            return Mono.just(0);
        }
        return Mono.fromCallable(() -> {
                    vectorIndex.remove(embeddingIds);
                    return embeddingDao.deleteByIds(embeddingIds);
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    private long persist(long ownerId, String sourceType, Long sourceId, String text, float[] vector) {
        long id = embeddingDao.insert(EmbeddingRecord.builder()
                .ownerId(ownerId)
                .sourceType(sourceType)
                .sourceId(sourceId)
                .contentText(text)
                .modelName(properties.getEmbedding().getModelName())
                .createdAt(OffsetDateTime.now(ZoneOffset.UTC))
                .build());

        if (vectorIndex.isAvailable()) {
            try {
                vectorIndex.store(id, vector);
            } catch (RuntimeException e) {
                log.warn("[embedding-store] Vector index write failed for embedding {} – {}", id, e.getMessage());
            }
        }
        return id;
    }

    private static SimilarEmbedding toSimilar(VectorMatch m) {
        return new SimilarEmbedding(m.embeddingId(), m.sourceType(), m.sourceId(), m.contentText(), m.distance());
    }
}
