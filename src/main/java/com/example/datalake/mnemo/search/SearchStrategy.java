package com.example.datalake.mnemo.search;

import reactor.core.publisher.Mono;

import java.util.List;

public interface SearchStrategy<Q, R> {
    String name();
    Mono<List<R>> search(Q query);
}
