package com.example.datalake.mnemo.dao;

import com.example.datalake.mnemo.dao.converter.KnowledgeMetadataConverter;
import com.example.datalake.mnemo.model.EntityType;
import com.example.datalake.mnemo.model.KnowledgeItem;
import com.example.datalake.mnemo.model.KnowledgeMetadata;
import com.example.datalake.mnemo.util.SqlPatterns;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;
import org.springframework.util.DigestUtils;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.List;
import java.util.StringJoiner;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class JdbcKnowledgeDao implements KnowledgeDao {

    private static final String COLUMNS = """
            id, owner_id, entity_type, content, metadata_json, confidence, embedding_id,
            created_at, updated_at, last_referenced_at
            """;

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final KnowledgeMetadataConverter metadataConverter = new KnowledgeMetadataConverter();

    private final RowMapper<KnowledgeItem> rowMapper = (rs, rowNum) -> KnowledgeItem.builder()
            .id(rs.getLong("id"))
            .ownerId(rs.getLong("owner_id"))
            .entityType(EntityType.fromCode(rs.getString("entity_type")))
            .content(rs.getString("content"))
            .metadata(metadataConverter.fromColumn(rs.getString("metadata_json")))
            .confidence(rs.getDouble("confidence"))
            .embeddingId(rs.getObject("embedding_id", Long.class))
            .createdAt(rs.getObject("created_at", OffsetDateTime.class))
            .updatedAt(rs.getObject("updated_at", OffsetDateTime.class))
            .lastReferencedAt(rs.getObject("last_referenced_at", OffsetDateTime.class))
            .build();

    @Override
    public long insert(KnowledgeItem item) {
        OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
        KnowledgeMetadata meta = item.getMetadata() == null ? KnowledgeMetadata.empty() : item.getMetadata();
        final String sql = """
                INSERT INTO knowledge (owner_id, entity_type, content, content_key, search_text, status,
                                       metadata_json, confidence, embedding_id,
                                       created_at, updated_at, last_referenced_at)
                VALUES (:owner, :type, :content, :contentKey, :searchText, :status,
                        :metadata, :confidence, :embeddingId,
                        :now, :now, :now)
                """;
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("owner", item.getOwnerId())
                .addValue("type", item.getEntityType().code())
                .addValue("content", item.getContent())
                .addValue("contentKey", contentKey(item.getContent()))
                .addValue("searchText", searchText(item.getContent(), meta))
                .addValue("status", statusColumn(item.getEntityType(), meta))
                .addValue("metadata", metadataConverter.toColumn(meta))
                .addValue("confidence", item.getConfidence())
                .addValue("embeddingId", item.getEmbeddingId())
                .addValue("now", now);

        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(sql, params, keyHolder, new String[]{"id"});
        return Objects.requireNonNull(keyHolder.getKey(), "no generated key for knowledge row").longValue();
    }

    @Override
    public Optional<KnowledgeItem> findById(long ownerId, long id) {
        final String sql = "SELECT " + COLUMNS + " FROM knowledge WHERE owner_id = :owner AND id = :id";
        return jdbcTemplate.query(sql, new MapSqlParameterSource()
                        .addValue("owner", ownerId)
                        .addValue("id", id), rowMapper)
                .stream()
                .findFirst();
    }

    @Override
    public List<KnowledgeItem> findByType(long ownerId, EntityType type, int limit, double minConfidence) {
        final String sql = "SELECT " + COLUMNS + """
                FROM knowledge
                WHERE owner_id = :owner
                  AND entity_type = :type
                  AND confidence >= :minConfidence
                ORDER BY created_at DESC, id DESC
                LIMIT :limit
                """;
        return jdbcTemplate.query(sql, new MapSqlParameterSource()
                .addValue("owner", ownerId)
                .addValue("type", type.code())
                .addValue("minConfidence", minConfidence)
                .addValue("limit", limit), rowMapper);
    }

    @Override
    public List<KnowledgeItem> findByIds(long ownerId, Collection<Long> ids, double minConfidence) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        final String sql = "SELECT " + COLUMNS + """
                FROM knowledge
                WHERE owner_id = :owner
                  AND id IN (:ids)
                  AND confidence >= :minConfidence
                """;
        return jdbcTemplate.query(sql, new MapSqlParameterSource()
                .addValue("owner", ownerId)
                .addValue("ids", ids)
                .addValue("minConfidence", minConfidence), rowMapper);
    }

    @Override
    public boolean existsWithContent(long ownerId, EntityType type, String content, Long excludeId) {
        StringBuilder sql = new StringBuilder("""
                SELECT COUNT(*) FROM knowledge
                WHERE owner_id = :owner
                  AND entity_type = :type
                  AND content_key = :contentKey
                """);
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("owner", ownerId)
                .addValue("type", type.code())
                .addValue("contentKey", contentKey(content));
        if (excludeId != null) {
            sql.append(" AND id <> :excludeId");
            params.addValue("excludeId", excludeId);
        }
        Long count = jdbcTemplate.queryForObject(sql.toString(), params, Long.class);
        return count != null && count > 0;
    }

    @Override
    public List<KnowledgeItem> searchFullText(long ownerId, EntityType type, String expression, int limit) {
        final String sql = "SELECT " + COLUMNS + """
                FROM knowledge
                WHERE owner_id = :owner
                  AND entity_type = :type
                  AND (status IS NULL OR status = 'active')
                  AND to_tsvector('simple', search_text) @@ websearch_to_tsquery('simple', :query)
                ORDER BY ts_rank_cd(to_tsvector('simple', search_text), websearch_to_tsquery('simple', :query)) DESC,
                         created_at DESC, id DESC
                LIMIT :limit
                """;
        return jdbcTemplate.query(sql, new MapSqlParameterSource()
                .addValue("owner", ownerId)
                .addValue("type", type.code())
                .addValue("query", expression)
                .addValue("limit", limit), rowMapper);
    }

    @Override
    public List<KnowledgeItem> searchLexical(long ownerId, EntityType type, Collection<String> phrases, int limit) {
        if (phrases == null || phrases.isEmpty()) {
            return List.of();
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("owner", ownerId)
                .addValue("type", type.code())
                .addValue("limit", limit);
        StringJoiner anyMatch = new StringJoiner(" OR ", "(", ")");
        StringJoiner hits = new StringJoiner(" + ", "(", ")");
        int i = 0;
        for (String phrase : phrases) {
            String key = "p" + i++;
            String clause = "LOWER(search_text) LIKE :" + key + SqlPatterns.ESCAPE_CLAUSE;
            anyMatch.add(clause);
            hits.add("CASE WHEN " + clause + " THEN 1 ELSE 0 END");
            params.addValue(key, SqlPatterns.containsIgnoreCase(phrase));
        }
        final String sql = "SELECT " + COLUMNS
                + " FROM knowledge WHERE owner_id = :owner AND entity_type = :type"
                + " AND (status IS NULL OR status = 'active')"
                + " AND " + anyMatch
                + " ORDER BY " + hits + " DESC, created_at DESC, id DESC LIMIT :limit";
        return jdbcTemplate.query(sql, params, rowMapper);
    }

    @Override
    public int update(long ownerId, long id, String content, KnowledgeMetadata metadata, OffsetDateTime updatedAt) {
        Optional<EntityType> type = findType(ownerId, id);
        if (type.isEmpty()) {
            return 0;
        }
        KnowledgeMetadata meta = metadata == null ? KnowledgeMetadata.empty() : metadata;
        final String sql = """
                UPDATE knowledge
                SET content = :content,
                    content_key = :contentKey,
                    search_text = :searchText,
                    status = :status,
                    metadata_json = :metadata,
                    updated_at = :updatedAt
                WHERE owner_id = :owner AND id = :id
                """;
        return jdbcTemplate.update(sql, new MapSqlParameterSource()
                .addValue("content", content)
                .addValue("contentKey", contentKey(content))
                .addValue("searchText", searchText(content, meta))
                .addValue("status", statusColumn(type.get(), meta))
                .addValue("metadata", metadataConverter.toColumn(meta))
                .addValue("updatedAt", updatedAt)
                .addValue("owner", ownerId)
                .addValue("id", id));
    }

    @Override
    public int updateEmbeddingId(long ownerId, long id, long embeddingId, String embeddedContent) {
        return jdbcTemplate.update("""
                        UPDATE knowledge SET embedding_id = :embeddingId
                        WHERE owner_id = :owner AND id = :id AND content = :content
                        """,
                new MapSqlParameterSource()
                        .addValue("embeddingId", embeddingId)
                        .addValue("owner", ownerId)
                        .addValue("id", id)
                        .addValue("content", embeddedContent));
    }

    @Override
    public int delete(long ownerId, long id) {
        return jdbcTemplate.update("DELETE FROM knowledge WHERE owner_id = :owner AND id = :id",
                new MapSqlParameterSource()
                        .addValue("owner", ownerId)
                        .addValue("id", id));
    }

    @Override
    public int touchReferenced(long ownerId, Collection<Long> ids, OffsetDateTime at) {
        if (ids == null || ids.isEmpty()) {
            return 0;
        }
        return jdbcTemplate.update(
                "UPDATE knowledge SET last_referenced_at = :at WHERE owner_id = :owner AND id IN (:ids)",
                new MapSqlParameterSource()
                        .addValue("at", at)
                        .addValue("owner", ownerId)
                        .addValue("ids", ids));
    }

    private Optional<EntityType> findType(long ownerId, long id) {
        return jdbcTemplate.queryForList("SELECT entity_type FROM knowledge WHERE owner_id = :owner AND id = :id",
                        new MapSqlParameterSource()
                                .addValue("owner", ownerId)
                                .addValue("id", id), String.class)
                .stream()
                .findFirst()
                .map(EntityType::fromCode);
    }

    static String normalize(String content) {
        return content == null ? "" : content.trim().toLowerCase(Locale.ROOT);
    }

    static String contentKey(String content) {
        return DigestUtils.md5DigestAsHex(normalize(content).getBytes(StandardCharsets.UTF_8));
    }

    static String searchText(String content, KnowledgeMetadata meta) {
        StringJoiner text = new StringJoiner(" ");
        text.add(content == null ? "" : content);
        if (StringUtils.hasText(meta.category())) {
            text.add(meta.category());
        }
        if (StringUtils.hasText(meta.description())) {
            text.add(meta.description());
        }
        return text.toString();
    }

    private static String statusColumn(EntityType type, KnowledgeMetadata meta) {
        return type == EntityType.GOAL ? meta.effectiveStatus().code() : null;
    }
}
