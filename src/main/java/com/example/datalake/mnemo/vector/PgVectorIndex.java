package com.example.datalake.mnemo.vector;

import com.example.datalake.mnemo.embedding.VectorCodec;
import com.example.datalake.mnemo.util.SqlPatterns;
import com.pgvector.PGvector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;

/**
 * Vector index on the PostgreSQL {@code vector} extension. Rows live in {@code embeddings_vec},
 * ordered by the {@code <->} (L2) operator.
 */
@Slf4j
public class PgVectorIndex implements VectorIndex {

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final int dimension;
    private volatile boolean available;

    public PgVectorIndex(NamedParameterJdbcTemplate jdbcTemplate, int dimension) {
        this.jdbcTemplate = jdbcTemplate;
        this.dimension = dimension;
    }

    /**
     * Enables the extension and creates the vector table.
     *
     * @return whether the index can be used
     */
    public boolean initialize() {
        try {
            jdbcTemplate.getJdbcTemplate().execute("CREATE EXTENSION IF NOT EXISTS vector");
            jdbcTemplate.getJdbcTemplate().execute("""
                    CREATE TABLE IF NOT EXISTS embeddings_vec (
                        embedding_id BIGINT PRIMARY KEY,
                        embedding vector(%d) NOT NULL
                    )
                    """.formatted(dimension));
            available = true;
        } catch (DataAccessException e) {
            log.info("[vector] pgvector extension not usable – {}", e.getMostSpecificCause().getMessage());
            available = false;
        }
        return available;
    }

    @Override
    public VectorMode mode() {
        return VectorMode.PGVECTOR;
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    @Override
    public void store(long embeddingId, float[] vector) {
        VectorCodec.requireDimension(vector, dimension);
        final String sql = """
                INSERT INTO embeddings_vec (embedding_id, embedding)
                VALUES (:id, :embedding)
                ON CONFLICT (embedding_id) DO UPDATE SET embedding = EXCLUDED.embedding
                """;
        jdbcTemplate.update(sql, new MapSqlParameterSource()
                .addValue("id", embeddingId)
                .addValue("embedding", new PGvector(vector)));
    }

    @Override
    public List<VectorMatch> nearestEmbeddings(float[] query, long ownerId, String sourceType, int limit) {
        VectorCodec.requireDimension(query, dimension);
        StringBuilder sql = new StringBuilder("""
                SELECT e.id, e.source_type, e.source_id, e.content_text, k.last_referenced_at,
                       v.embedding <-> :query AS distance
                FROM embeddings_vec v
                JOIN embeddings e ON e.id = v.embedding_id
                LEFT JOIN knowledge k ON k.embedding_id = e.id AND k.owner_id = e.owner_id
                WHERE e.owner_id = :owner
                """);
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("query", new PGvector(query))
                .addValue("owner", ownerId)
                .addValue("limit", limit);
        if (sourceType != null) {
            sql.append(" AND e.source_type = :sourceType ");
            params.addValue("sourceType", sourceType);
        }
        sql.append(" ORDER BY distance ASC LIMIT :limit");

        return jdbcTemplate.query(sql.toString(), params, (rs, rowNum) -> new VectorMatch(
                rs.getLong("id"),
                rs.getString("source_type"),
                rs.getObject("source_id", Long.class),
                rs.getString("content_text"),
                rs.getDouble("distance"),
                rs.getObject("last_referenced_at", OffsetDateTime.class)));
    }

    @Override
    public List<ChunkMatch> nearestChunks(float[] query, String pathPrefix, int limit) {
        VectorCodec.requireDimension(query, dimension);
        StringBuilder sql = new StringBuilder("""
                SELECT c.path, c.chunk_index, c.content_text, v.embedding <-> :query AS distance
                FROM embeddings_vec v
                JOIN file_chunks c ON c.embedding_id = v.embedding_id
                WHERE 1=1
                """);
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("query", new PGvector(query))
                .addValue("limit", limit);
        if (pathPrefix != null) {
            sql.append(" AND c.path LIKE :prefix").append(SqlPatterns.ESCAPE_CLAUSE).append(' ');
            params.addValue("prefix", SqlPatterns.startsWith(pathPrefix));
        }
        sql.append(" ORDER BY distance ASC LIMIT :limit");

        return jdbcTemplate.query(sql.toString(), params, (rs, rowNum) -> new ChunkMatch(
                rs.getString("path"),
                rs.getInt("chunk_index"),
                rs.getString("content_text"),
                rs.getDouble("distance")));
    }

    @Override
    public int remove(Collection<Long> embeddingIds) {
        if (embeddingIds == null || embeddingIds.isEmpty()) {
            return 0;
        }
        return jdbcTemplate.update("DELETE FROM embeddings_vec WHERE embedding_id IN (:ids)",
                new MapSqlParameterSource("ids", embeddingIds));
    }
}
