package com.example.datalake.mnemo.search;

import com.example.datalake.mnemo.model.SimilarEmbedding;
import com.example.datalake.mnemo.service.EmbeddingStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Objects;

/**
 * Knowledge ids ranked by embedding similarity with recency boosting.
 */
@Component
@RequiredArgsConstructor
public class VectorKnowledgeSearch implements SearchStrategy<KnowledgeQuery, Long> {

    private final EmbeddingStore embeddingStore;

    @Override
    public String name() {
        return "vector";
    }

    @Override
    public Mono<List<Long>> search(KnowledgeQuery query) {
        return embeddingStore
                .searchSimilarForType(query.ownerId(), query.text(), query.type().sourceType(), query.limit(), true)
                .map(hits -> hits.stream()
                        .map(SimilarEmbedding::sourceId)
                        .filter(Objects::nonNull)
                        .distinct()
                        .toList());
    }
}
