package com.example.datalake.mnemo.model;

/**
 * A file chunk returned by search. {@code distance} is null for lexical matches.
 */
public record FileSearchHit(
        String path,
        int chunkIndex,
        String content,
        Double distance
) {
}
