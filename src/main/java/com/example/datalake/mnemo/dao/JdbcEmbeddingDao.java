package com.example.datalake.mnemo.dao;

import com.example.datalake.mnemo.model.EmbeddingRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class JdbcEmbeddingDao implements EmbeddingDao {

    private final NamedParameterJdbcTemplate jdbcTemplate;

    private static final RowMapper<EmbeddingRecord> ROW_MAPPER = (rs, rowNum) -> EmbeddingRecord.builder()
            .id(rs.getLong("id"))
            .ownerId(rs.getLong("owner_id"))
            .sourceType(rs.getString("source_type"))
            .sourceId(rs.getObject("source_id", Long.class))
            .contentText(rs.getString("content_text"))
            .modelName(rs.getString("model_name"))
            .createdAt(rs.getObject("created_at", OffsetDateTime.class))
            .build();

    @Override
    public long insert(EmbeddingRecord record) {
        final String sql = """
                INSERT INTO embeddings (owner_id, source_type, source_id, content_text, model_name, created_at)
                VALUES (:owner, :sourceType, :sourceId, :text, :model, :createdAt)
                """;
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("owner", record.getOwnerId())
                .addValue("sourceType", record.getSourceType())
                .addValue("sourceId", record.getSourceId())
                .addValue("text", record.getContentText())
                .addValue("model", record.getModelName())
                .addValue("createdAt", record.getCreatedAt() != null
                        ? record.getCreatedAt()
                        : OffsetDateTime.now(ZoneOffset.UTC));

        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(sql, params, keyHolder, new String[]{"id"});
        return Objects.requireNonNull(keyHolder.getKey(), "no generated key for embedding row").longValue();
    }

    @Override
    public Optional<EmbeddingRecord> findById(long id) {
        return jdbcTemplate.query(
                        "SELECT id, owner_id, source_type, source_id, content_text, model_name, created_at FROM embeddings WHERE id = :id",
                        new MapSqlParameterSource("id", id), ROW_MAPPER)
                .stream()
                .findFirst();
    }

    @Override
    public List<Long> findOrphanIds(OffsetDateTime createdBefore, int limit) {
        final String sql = """
                SELECT e.id FROM embeddings e
                WHERE e.created_at < :createdBefore
                  AND NOT EXISTS (SELECT 1 FROM knowledge k WHERE k.embedding_id = e.id)
                  AND NOT EXISTS (SELECT 1 FROM file_chunks c WHERE c.embedding_id = e.id)
                ORDER BY e.id
                LIMIT :limit
                """;
        return jdbcTemplate.queryForList(sql, new MapSqlParameterSource()
                .addValue("createdBefore", createdBefore)
                .addValue("limit", limit), Long.class);
    }

    @Override
    public int deleteByIds(Collection<Long> ids) {
        if (ids == null || ids.isEmpty()) {
            return 0;
        }
        return jdbcTemplate.update("DELETE FROM embeddings WHERE id IN (:ids)",
                new MapSqlParameterSource("ids", ids));
    }
}
