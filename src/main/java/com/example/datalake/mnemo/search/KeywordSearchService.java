package com.example.datalake.mnemo.search;

import com.example.datalake.mnemo.dao.KnowledgeDao;
import com.example.datalake.mnemo.model.EntityType;
import com.example.datalake.mnemo.model.KnowledgeItem;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Optional;

/**
 * Ranked keyword search over knowledge items, used when similarity search is off or finds
 * nothing. Ranking happens in the database: PostgreSQL full text where available, a LIKE
 * match count elsewhere. Never fails: any error degrades to an empty result.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class KeywordSearchService {

    private final KnowledgeDao knowledgeDao;
    private final KeywordMode mode;

    public Mono<List<KnowledgeItem>> searchFacts(long ownerId, String query, int limit) {
        return search(ownerId, EntityType.FACT, query, limit);
    }

    /**
     * Active goals only.
     */
    public Mono<List<KnowledgeItem>> searchGoals(long ownerId, String query, int limit) {
        return search(ownerId, EntityType.GOAL, query, limit);
    }

    public Mono<List<KnowledgeItem>> search(long ownerId, EntityType type, String query, int limit) {
        Optional<KeywordQuery> parsed = KeywordQuery.parse(query);
        if (parsed.isEmpty() || limit <= 0) {
            return Mono.just(List.of());
        }
        KeywordQuery keywordQuery = parsed.get();

        return Mono.fromCallable(() -> find(ownerId, type, keywordQuery, limit))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnNext(hits -> log.debug("[keyword] {} query {} matched {} rows", type.code(), keywordQuery, hits.size()))
                .onErrorResume(e -> {
                    log.warn("[keyword] {} search failed for owner {} – {}", type.code(), ownerId, e.getMessage());
                    return Mono.just(List.of());
                });
    }

    private List<KnowledgeItem> find(long ownerId, EntityType type, KeywordQuery query, int limit) {
        return mode == KeywordMode.FULLTEXT
                ? knowledgeDao.searchFullText(ownerId, type, query.toFtsExpression(), limit)
                : knowledgeDao.searchLexical(ownerId, type, query.phrases(), limit);
    }
}
