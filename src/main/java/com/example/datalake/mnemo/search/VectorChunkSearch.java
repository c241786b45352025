package com.example.datalake.mnemo.search;

import com.example.datalake.mnemo.model.FileSearchHit;
import com.example.datalake.mnemo.service.EmbeddingStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;

@Component
@RequiredArgsConstructor
public class VectorChunkSearch implements SearchStrategy<ChunkQuery, FileSearchHit> {

    private final EmbeddingStore embeddingStore;

    @Override
    public String name() {
        return "vector";
    }

    @Override
    public Mono<List<FileSearchHit>> search(ChunkQuery query) {
        return embeddingStore.searchChunks(query.text(), query.pathPrefix(), query.limit())
                .map(matches -> matches.stream()
                        .map(m -> new FileSearchHit(m.path(), m.chunkIndex(), m.contentText(), m.distance()))
                        .toList());
    }
}
