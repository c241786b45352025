package com.example.datalake.mnemo.dao;

import com.example.datalake.mnemo.model.FileChunk;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface FileChunkDao {

    /**
     * Every indexed path with the file mtime recorded at its last indexing.
     */
    Map<String, Long> findPathMtimes();

    /**
     * Inserts the chunk or replaces the row at the same {@code (path, chunk_index)}.
     */
    void upsert(FileChunk chunk);

    /**
     * Removes chunks of {@code path} whose index is {@code >= fromIndex}.
     */
    int deleteFrom(String path, int fromIndex);

    int deleteByPath(String path);

    List<FileChunk> findByPath(String path);

    /**
     * Chunks containing any of {@code tokens} (case-insensitive), most token hits first.
     */
    List<FileChunk> searchLexical(Collection<String> tokens, String pathPrefix, int limit);

    /**
     * PostgreSQL full-text match, best {@code ts_rank_cd} first.
     *
     * @param expression websearch syntax, e.g. {@code "dark mode" OR "tea"}
     */
    List<FileChunk> searchFullText(String expression, String pathPrefix, int limit);

    long countFiles();

    long countChunks();

    Optional<OffsetDateTime> lastIndexedAt();
}
