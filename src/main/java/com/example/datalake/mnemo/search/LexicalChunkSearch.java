package com.example.datalake.mnemo.search;

import com.example.datalake.mnemo.dao.FileChunkDao;
import com.example.datalake.mnemo.model.FileSearchHit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Optional;

/**
 * Keyword search over file chunks: PostgreSQL full text, or a case-insensitive substring
 * match of any query token ranked by how many tokens a chunk contains.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LexicalChunkSearch implements SearchStrategy<ChunkQuery, FileSearchHit> {

    private final FileChunkDao fileChunkDao;
    private final KeywordMode mode;

    @Override
    public String name() {
        return "lexical";
    }

    @Override
    public Mono<List<FileSearchHit>> search(ChunkQuery query) {
        Optional<KeywordQuery> parsed = KeywordQuery.parse(query.text());
        if (parsed.isEmpty() || query.limit() <= 0) {
            return Mono.just(List.of());
        }
        KeywordQuery keywords = parsed.get();
        return Mono.fromCallable(() -> mode == KeywordMode.FULLTEXT
                        ? fileChunkDao.searchFullText(keywords.toFtsExpression(), query.pathPrefix(), query.limit())
                        : fileChunkDao.searchLexical(keywords.phrases(), query.pathPrefix(), query.limit()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(chunks -> chunks.stream()
                        .map(c -> new FileSearchHit(c.getPath(), c.getChunkIndex(), c.getContentText(), null))
                        .toList())
                .onErrorResume(e -> {
                    log.warn("[keyword] File chunk search failed – {}", e.getMessage());
                    return Mono.just(List.of());
                });
    }
}
