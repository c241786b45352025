package com.example.datalake.mnemo.vector;

import com.example.datalake.mnemo.embedding.VectorCodec;
import com.example.datalake.mnemo.util.SqlPatterns;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Vector index that keeps packed float32 blobs in {@code embedding_vectors} and ranks by an
 * exact L2 scan in the JVM. Works on any JDBC database; fine for a single user's memory.
 */
@Slf4j
public class ExactScanVectorIndex implements VectorIndex {

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final int dimension;

    public ExactScanVectorIndex(NamedParameterJdbcTemplate jdbcTemplate, int dimension) {
        this.jdbcTemplate = jdbcTemplate;
        this.dimension = dimension;
    }

    @Override
    public VectorMode mode() {
        return VectorMode.EXACT;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public void store(long embeddingId, float[] vector) {
        VectorCodec.requireDimension(vector, dimension);
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", embeddingId)
                .addValue("dimension", vector.length)
                .addValue("vector", VectorCodec.pack(vector));
        int updated = jdbcTemplate.update(
                "UPDATE embedding_vectors SET dimension = :dimension, vector = :vector WHERE embedding_id = :id",
                params);
        if (updated == 0) {
            jdbcTemplate.update(
                    "INSERT INTO embedding_vectors (embedding_id, dimension, vector) VALUES (:id, :dimension, :vector)",
                    params);
        }
    }

    @Override
    public List<VectorMatch> nearestEmbeddings(float[] query, long ownerId, String sourceType, int limit) {
        VectorCodec.requireDimension(query, dimension);
        StringBuilder sql = new StringBuilder("""
                SELECT e.id, e.source_type, e.source_id, e.content_text, k.last_referenced_at,
                       v.dimension, v.vector
                FROM embedding_vectors v
                JOIN embeddings e ON e.id = v.embedding_id
                LEFT JOIN knowledge k ON k.embedding_id = e.id AND k.owner_id = e.owner_id
                WHERE e.owner_id = :owner
                """);
        MapSqlParameterSource params = new MapSqlParameterSource("owner", ownerId);
        if (sourceType != null) {
            sql.append(" AND e.source_type = :sourceType");
            params.addValue("sourceType", sourceType);
        }

        TopK<VectorMatch> top = new TopK<>(limit, Comparator.comparingDouble(VectorMatch::distance));
        jdbcTemplate.query(sql.toString(), params, rs -> {
            if (rs.getInt("dimension") != dimension) {
                log.debug("[vector] Skipping embedding {} with dimension {}", rs.getLong("id"), rs.getInt("dimension"));
                return;
            }
            double distance = VectorCodec.l2Distance(query, VectorCodec.unpack(rs.getBytes("vector")));
            top.offer(new VectorMatch(
                    rs.getLong("id"),
                    rs.getString("source_type"),
                    rs.getObject("source_id", Long.class),
                    rs.getString("content_text"),
                    distance,
                    rs.getObject("last_referenced_at", OffsetDateTime.class)));
        });
        return top.sorted();
    }

    @Override
    public List<ChunkMatch> nearestChunks(float[] query, String pathPrefix, int limit) {
        VectorCodec.requireDimension(query, dimension);
        StringBuilder sql = new StringBuilder("""
                SELECT c.path, c.chunk_index, c.content_text, v.dimension, v.vector
                FROM embedding_vectors v
                JOIN file_chunks c ON c.embedding_id = v.embedding_id
                WHERE 1=1
                """);
        MapSqlParameterSource params = new MapSqlParameterSource();
        if (pathPrefix != null) {
            sql.append(" AND c.path LIKE :prefix").append(SqlPatterns.ESCAPE_CLAUSE);
            params.addValue("prefix", SqlPatterns.startsWith(pathPrefix));
        }

        TopK<ChunkMatch> top = new TopK<>(limit, Comparator.comparingDouble(ChunkMatch::distance));
        jdbcTemplate.query(sql.toString(), params, rs -> {
            if (rs.getInt("dimension") != dimension) {
                return;
            }
            double distance = VectorCodec.l2Distance(query, VectorCodec.unpack(rs.getBytes("vector")));
            top.offer(new ChunkMatch(
                    rs.getString("path"),
                    rs.getInt("chunk_index"),
                    rs.getString("content_text"),
                    distance));
        });
        return top.sorted();
    }

    @Override
    public int remove(Collection<Long> embeddingIds) {
        if (embeddingIds == null || embeddingIds.isEmpty()) {
            return 0;
        }
        return jdbcTemplate.update("DELETE FROM embedding_vectors WHERE embedding_id IN (:ids)",
                new MapSqlParameterSource("ids", embeddingIds));
    }

    /**
     * Keeps the {@code k} smallest elements seen so far.
     */
    private static final class TopK<T> {

        private final int k;
        private final Comparator<T> order;
        private final PriorityQueue<T> heap;

        TopK(int k, Comparator<T> order) {
            this.k = k;
            this.order = order;
            this.heap = new PriorityQueue<>(Math.max(1, k), order.reversed());
        }

        void offer(T candidate) {
            if (k <= 0) {
                return;
            }
            if (heap.size() < k) {
                heap.add(candidate);
            } else if (order.compare(candidate, heap.peek()) < 0) {
                heap.poll();
                heap.add(candidate);
            }
        }

        List<T> sorted() {
            List<T> out = new ArrayList<>(heap);
            out.sort(order);
            return out;
        }
    }
}
