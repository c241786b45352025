package com.example.datalake.mnemo.search;

/**
 * @param pathPrefix absolute path prefix, or null for all indexed files
 */
public record ChunkQuery(String text, String pathPrefix, int limit) {
}
