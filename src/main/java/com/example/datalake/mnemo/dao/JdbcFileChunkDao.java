package com.example.datalake.mnemo.dao;

import com.example.datalake.mnemo.model.FileChunk;
import com.example.datalake.mnemo.util.SqlPatterns;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class JdbcFileChunkDao implements FileChunkDao {

    private final NamedParameterJdbcTemplate jdbcTemplate;

    private static final RowMapper<FileChunk> ROW_MAPPER = (rs, rowNum) -> FileChunk.builder()
            .id(rs.getLong("id"))
            .path(rs.getString("path"))
            .chunkIndex(rs.getInt("chunk_index"))
            .contentText(rs.getString("content_text"))
            .embeddingId(rs.getObject("embedding_id", Long.class))
            .fileMtime(rs.getLong("file_mtime"))
            .indexedAt(rs.getObject("indexed_at", OffsetDateTime.class))
            .build();

    @Override
    public Map<String, Long> findPathMtimes() {
        Map<String, Long> out = new HashMap<>();
        jdbcTemplate.query("SELECT path, MAX(file_mtime) AS mtime FROM file_chunks GROUP BY path",
                rs -> {
                    out.put(rs.getString("path"), rs.getLong("mtime"));
                });
        return out;
    }

    @Override
    public void upsert(FileChunk chunk) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("path", chunk.getPath())
                .addValue("idx", chunk.getChunkIndex())
                .addValue("text", chunk.getContentText())
                .addValue("embeddingId", chunk.getEmbeddingId())
                .addValue("mtime", chunk.getFileMtime())
                .addValue("indexedAt", chunk.getIndexedAt() != null
                        ? chunk.getIndexedAt()
                        : OffsetDateTime.now(ZoneOffset.UTC));

        int updated = jdbcTemplate.update("""
                UPDATE file_chunks
                SET content_text = :text, embedding_id = :embeddingId, file_mtime = :mtime, indexed_at = :indexedAt
                WHERE path = :path AND chunk_index = :idx
                """, params);
        if (updated == 0) {
            jdbcTemplate.update("""
                    INSERT INTO file_chunks (path, chunk_index, content_text, embedding_id, file_mtime, indexed_at)
                    VALUES (:path, :idx, :text, :embeddingId, :mtime, :indexedAt)
                    """, params);
        }
    }

    @Override
    public int deleteFrom(String path, int fromIndex) {
        return jdbcTemplate.update("DELETE FROM file_chunks WHERE path = :path AND chunk_index >= :from",
                new MapSqlParameterSource()
                        .addValue("path", path)
                        .addValue("from", fromIndex));
    }

    @Override
    public int deleteByPath(String path) {
        return jdbcTemplate.update("DELETE FROM file_chunks WHERE path = :path",
                new MapSqlParameterSource("path", path));
    }

    @Override
    public List<FileChunk> findByPath(String path) {
        return jdbcTemplate.query("""
                        SELECT id, path, chunk_index, content_text, embedding_id, file_mtime, indexed_at
                        FROM file_chunks WHERE path = :path ORDER BY chunk_index
                        """,
                new MapSqlParameterSource("path", path), ROW_MAPPER);
    }

    @Override
    public List<FileChunk> searchLexical(Collection<String> tokens, String pathPrefix, int limit) {
        if (tokens == null || tokens.isEmpty()) {
            return List.of();
        }
        StringBuilder sql = new StringBuilder("""
                SELECT id, path, chunk_index, content_text, embedding_id, file_mtime, indexed_at
                FROM file_chunks
                WHERE (
                """);
        StringBuilder scoreExpr = new StringBuilder();
        MapSqlParameterSource params = new MapSqlParameterSource();

        int i = 0;
        for (String token : tokens) {
            String key = "t" + i;
            String clause = "LOWER(content_text) LIKE :" + key + SqlPatterns.ESCAPE_CLAUSE;
            if (i > 0) {
                sql.append(" OR ");
                scoreExpr.append(" + ");
            }
            sql.append(clause);
            scoreExpr.append("CASE WHEN ").append(clause).append(" THEN 1 ELSE 0 END");
            params.addValue(key, SqlPatterns.containsIgnoreCase(token));
            i++;
        }
        sql.append(") ");

        if (pathPrefix != null) {
            sql.append(" AND path LIKE :prefix").append(SqlPatterns.ESCAPE_CLAUSE);
            params.addValue("prefix", SqlPatterns.startsWith(pathPrefix));
        }

        sql.append(" ORDER BY (").append(scoreExpr).append(") DESC, indexed_at DESC, chunk_index ASC LIMIT :limit");
        params.addValue("limit", limit);

        return jdbcTemplate.query(sql.toString(), params, ROW_MAPPER);
    }

    @Override
    public List<FileChunk> searchFullText(String expression, String pathPrefix, int limit) {
        StringBuilder sql = new StringBuilder("""
                SELECT id, path, chunk_index, content_text, embedding_id, file_mtime, indexed_at
                FROM file_chunks
                WHERE to_tsvector('simple', content_text) @@ websearch_to_tsquery('simple', :query)
                """);
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("query", expression)
                .addValue("limit", limit);
        if (pathPrefix != null) {
            sql.append(" AND path LIKE :prefix").append(SqlPatterns.ESCAPE_CLAUSE);
            params.addValue("prefix", SqlPatterns.startsWith(pathPrefix));
        }
        sql.append(" ORDER BY ts_rank_cd(to_tsvector('simple', content_text), websearch_to_tsquery('simple', :query)) DESC,")
                .append(" indexed_at DESC, chunk_index ASC LIMIT :limit");
        return jdbcTemplate.query(sql.toString(), params, ROW_MAPPER);
    }

    @Override
    public long countFiles() {
        Long n = jdbcTemplate.getJdbcTemplate().queryForObject("SELECT COUNT(DISTINCT path) FROM file_chunks", Long.class);
        return n == null ? 0 : n;
    }

    @Override
    public long countChunks() {
        Long n = jdbcTemplate.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM file_chunks", Long.class);
        return n == null ? 0 : n;
    }

    @Override
    public Optional<OffsetDateTime> lastIndexedAt() {
        return Optional.ofNullable(jdbcTemplate.getJdbcTemplate()
                .queryForObject("SELECT MAX(indexed_at) FROM file_chunks", OffsetDateTime.class));
    }
}
