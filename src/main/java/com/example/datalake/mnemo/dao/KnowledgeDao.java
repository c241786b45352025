package com.example.datalake.mnemo.dao;

import com.example.datalake.mnemo.model.EntityType;
import com.example.datalake.mnemo.model.KnowledgeItem;
import com.example.datalake.mnemo.model.KnowledgeMetadata;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Rows of {@code knowledge}. Every method is scoped to one owner.
 */
public interface KnowledgeDao {

    /**
     * @throws org.springframework.dao.DuplicateKeyException when the owner already has an item of
     *                                                       that type with the same normalized content
     */
    long insert(KnowledgeItem item);

    Optional<KnowledgeItem> findById(long ownerId, long id);

    /**
     * Newest first.
     */
    List<KnowledgeItem> findByType(long ownerId, EntityType type, int limit, double minConfidence);

    /**
     * Items among {@code ids}, in no particular order. Unknown ids and other owners' ids are ignored.
     */
    List<KnowledgeItem> findByIds(long ownerId, Collection<Long> ids, double minConfidence);

    /**
     * Whether another item of the owner and type holds the same content, compared
     * case-insensitively after trimming.
     *
     * @param excludeId item to ignore (the one being updated), may be null
     */
    boolean existsWithContent(long ownerId, EntityType type, String content, Long excludeId);

    /**
     * Full-text match in PostgreSQL, best {@code ts_rank_cd} first. Inactive goals are excluded.
     *
     * @param expression websearch syntax, e.g. {@code "dark mode" OR "tea"}
     */
    List<KnowledgeItem> searchFullText(long ownerId, EntityType type, String expression, int limit);

    /**
     * Portable fallback: case-insensitive substring match of any phrase, most phrase hits first.
     * Inactive goals are excluded.
     */
    List<KnowledgeItem> searchLexical(long ownerId, EntityType type, Collection<String> phrases, int limit);

    /**
     * Overwrites content and metadata, and the search columns derived from them.
     *
     * @throws org.springframework.dao.DuplicateKeyException when the new content collides with another item
     */
    int update(long ownerId, long id, String content, KnowledgeMetadata metadata, OffsetDateTime updatedAt);

    /**
     * Links an embedding only while the row still holds the text it was computed from.
     *
     * @return 0 when the content has changed since, or the row is gone
     */
    int updateEmbeddingId(long ownerId, long id, long embeddingId, String embeddedContent);

    int delete(long ownerId, long id);

    int touchReferenced(long ownerId, Collection<Long> ids, OffsetDateTime at);
}
