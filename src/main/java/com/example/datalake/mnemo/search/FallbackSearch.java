package com.example.datalake.mnemo.search;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Tries each strategy in order and returns the first non-empty result. A failing strategy
 * counts as empty.
 */
@Slf4j
public class FallbackSearch<Q, R> implements SearchStrategy<Q, R> {

    private final String name;
    private final List<SearchStrategy<Q, R>> chain;

    public FallbackSearch(String name, List<SearchStrategy<Q, R>> chain) {
        if (chain.isEmpty()) {
            throw new IllegalArgumentException("fallback chain must not be empty");
        }
        this.name = name;
        this.chain = List.copyOf(chain);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Mono<List<R>> search(Q query) {
        return Flux.fromIterable(chain)
                .concatMap(strategy -> strategy.search(query)
                        .onErrorResume(e -> {
                            log.warn("[{}] {} failed, trying next – {}", name, strategy.name(), e.getMessage());
                            return Mono.just(List.of());
                        })
                        .filter(results -> !results.isEmpty())
                        .doOnNext(results -> log.debug("[{}] {} returned {} results", name, strategy.name(), results.size())))
                .next()
                .defaultIfEmpty(List.of());
    }
}
