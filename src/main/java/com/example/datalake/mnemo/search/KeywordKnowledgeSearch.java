package com.example.datalake.mnemo.search;

import com.example.datalake.mnemo.model.KnowledgeItem;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;

@Component
@RequiredArgsConstructor
public class KeywordKnowledgeSearch implements SearchStrategy<KnowledgeQuery, Long> {

    private final KeywordSearchService keywordSearchService;

    @Override
    public String name() {
        return "keyword";
    }

    @Override
    public Mono<List<Long>> search(KnowledgeQuery query) {
        return keywordSearchService.search(query.ownerId(), query.type(), query.text(), query.limit())
                .map(items -> items.stream().map(KnowledgeItem::getId).toList());
    }
}
