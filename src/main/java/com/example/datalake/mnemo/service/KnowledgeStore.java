package com.example.datalake.mnemo.service;

import com.example.datalake.mnemo.dao.KnowledgeDao;
import com.example.datalake.mnemo.exception.DuplicateKnowledgeException;
import com.example.datalake.mnemo.exception.InvalidOwnerException;
import com.example.datalake.mnemo.model.EntityType;
import com.example.datalake.mnemo.model.GoalStatus;
import com.example.datalake.mnemo.model.KnowledgeItem;
import com.example.datalake.mnemo.model.KnowledgeMetadata;
import com.example.datalake.mnemo.model.UpsertResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CRUD and deduplication of facts, goals and list items.
 *
 * <p>Writes commit first; the embedding is produced afterwards on a detached pipeline and
 * attached to the row when it lands, provided the row still holds the embedded text. A failed
 * embedding only leaves {@code embedding_id} empty, the item stays searchable by keyword.
 *
 * <p>Exact duplicates are also caught by the unique content key in the database, which covers
 * two writers passing the duplicate check at the same time.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class KnowledgeStore {

    private static final int ALL_ROWS = Integer.MAX_VALUE;

    private final KnowledgeDao knowledgeDao;
    private final EmbeddingStore embeddingStore;

    /**
     * Inserts every item that is not a duplicate of an existing one. Items need
     * {@code entityType} and {@code content}; their {@code ownerId} is ignored.
     */
    public Mono<UpsertResult> upsert(long ownerId, List<KnowledgeItem> items) {
        return onOwner(ownerId, () -> {
            List<Long> inserted = new ArrayList<>();
            int skipped = 0;
            for (KnowledgeItem item : items) {
                String content = item.getContent() == null ? "" : item.getContent().trim();
                if (content.isEmpty() || item.getEntityType() == null) {
                    skipped++;
                    continue;
                }
                if (isDuplicate(ownerId, item.getEntityType(), content, null)) {
                    log.debug("[knowledge] Skipping duplicate {} for owner {}", item.getEntityType().code(), ownerId);
                    skipped++;
                    continue;
                }
                try {
                    inserted.add(insert(ownerId, item.getEntityType(), content, item.getMetadata(), item.getConfidence()));
                } catch (DuplicateKeyException e) {
                    log.debug("[knowledge] Concurrent duplicate {} for owner {}, skipped", item.getEntityType().code(), ownerId);
                    skipped++;
                }
            }
            log.info("[knowledge] Upsert for owner {}: {} inserted, {} skipped", ownerId, inserted.size(), skipped);
            return new UpsertResult(inserted, skipped);
        });
    }

    public Mono<Long> addItem(long ownerId, EntityType type, String content, KnowledgeMetadata metadata) {
        return addItem(ownerId, type, content, metadata, 1.0);
    }

    /**
     * @throws DuplicateKnowledgeException (as an error signal) when the owner already has the same item
     */
    public Mono<Long> addItem(long ownerId, EntityType type, String content, KnowledgeMetadata metadata, double confidence) {
        if (type == null || !StringUtils.hasText(content)) {
            return Mono.error(new IllegalArgumentException("type and content are required"));
        }
        if (confidence < 0.0 || confidence > 1.0) {
            return Mono.error(new IllegalArgumentException("confidence must be within [0, 1], got " + confidence));
        }
        String trimmed = content.trim();
        return onOwner(ownerId, () -> {
            if (isDuplicate(ownerId, type, trimmed, null)) {
                throw new DuplicateKnowledgeException(ownerId, type, trimmed);
            }
            try {
                return insert(ownerId, type, trimmed, metadata, confidence);
            } catch (DuplicateKeyException e) {
                throw new DuplicateKnowledgeException(ownerId, type, trimmed);
            }
        });
    }

    /**
     * Changes content and/or metadata. A content change re-embeds the item; the previous
     * embedding is left for the janitor.
     *
     * @return false when there is nothing to change or no such item for this owner
     */
    public Mono<Boolean> update(long ownerId, long id, String content, KnowledgeMetadata metadata) {
        if (content == null && metadata == null) {
            return onOwner(ownerId, () -> false);
        }
        if (content != null && content.isBlank()) {
            return Mono.error(new IllegalArgumentException("content must not be blank"));
        }
        String trimmed = content == null ? null : content.trim();
        return onOwner(ownerId, () -> {
            Optional<KnowledgeItem> existing = knowledgeDao.findById(ownerId, id);
            if (existing.isEmpty()) {
                return false;
            }
            KnowledgeItem current = existing.get();
            boolean contentChanged = trimmed != null && !trimmed.equals(current.getContent());
            if (contentChanged && isDuplicate(ownerId, current.getEntityType(), trimmed, id)) {
                throw new DuplicateKnowledgeException(ownerId, current.getEntityType(), trimmed);
            }
            String newContent = contentChanged ? trimmed : current.getContent();
            KnowledgeMetadata newMetadata = metadata == null ? current.getMetadata() : metadata;
            int updated;
            try {
                updated = knowledgeDao.update(ownerId, id, newContent, newMetadata, now());
            } catch (DuplicateKeyException e) {
                throw new DuplicateKnowledgeException(ownerId, current.getEntityType(), trimmed);
            }
            if (updated > 0 && contentChanged) {
                embedInBackground(ownerId, id, current.getEntityType(), trimmed);
            }
            return updated > 0;
        });
    }

    public Mono<Boolean> delete(long ownerId, long id) {
        return onOwner(ownerId, () -> knowledgeDao.delete(ownerId, id) > 0);
    }

    /**
     * Newest first, at least {@code minConfidence}.
     */
    public Mono<List<KnowledgeItem>> getByType(long ownerId, EntityType type, int limit, double minConfidence) {
        if (limit <= 0) {
            return onOwner(ownerId, List::of);
        }
        return onOwner(ownerId, () -> knowledgeDao.findByType(ownerId, type, limit, minConfidence));
    }

    /**
     * Items in the order of {@code ids}; missing, foreign or low-confidence ids are dropped.
     */
    public Mono<List<KnowledgeItem>> getByIds(long ownerId, List<Long> ids, double minConfidence) {
        if (ids == null || ids.isEmpty()) {
            return onOwner(ownerId, List::of);
        }
        return onOwner(ownerId, () -> {
            Map<Long, Integer> rank = new HashMap<>();
            for (int i = 0; i < ids.size(); i++) {
                rank.putIfAbsent(ids.get(i), i);
            }
            return knowledgeDao.findByIds(ownerId, ids, minConfidence).stream()
                    .sorted(Comparator.comparingInt(item -> rank.getOrDefault(item.getId(), Integer.MAX_VALUE)))
                    .toList();
        });
    }

    /**
     * Marks items as just surfaced to the user, which feeds the recency boost.
     */
    public Mono<Integer> touchReferenced(long ownerId, Collection<Long> ids) {
        if (ids == null || ids.isEmpty()) {
            return onOwner(ownerId, () -> 0);
        }
        return onOwner(ownerId, () -> knowledgeDao.touchReferenced(ownerId, ids, now()));
    }

    private long insert(long ownerId, EntityType type, String content, KnowledgeMetadata metadata, double confidence) {
        KnowledgeMetadata meta = metadata == null ? KnowledgeMetadata.empty() : metadata;
        if (type == EntityType.GOAL && meta.status() == null) {
            meta = meta.withStatus(GoalStatus.ACTIVE);
        }
        long id = knowledgeDao.insert(KnowledgeItem.builder()
                .ownerId(ownerId)
                .entityType(type)
                .content(content)
                .metadata(meta)
                .confidence(confidence)
                .build());
        embedInBackground(ownerId, id, type, content);
        return id;
    }

    /**
     * Exact match (case-insensitive, trimmed); goals also collide when either active title
     * contains the other.
     */
    private boolean isDuplicate(long ownerId, EntityType type, String content, Long excludeId) {
        if (knowledgeDao.existsWithContent(ownerId, type, content, excludeId)) {
            return true;
        }
        if (type != EntityType.GOAL) {
            return false;
        }
        String candidate = normalize(content);
        return knowledgeDao.findByType(ownerId, EntityType.GOAL, ALL_ROWS, 0.0).stream()
                .filter(g -> excludeId == null || !excludeId.equals(g.getId()))
                .filter(g -> g.getMetadata().effectiveStatus() == GoalStatus.ACTIVE)
                .map(g -> normalize(g.getContent()))
                .anyMatch(existing -> existing.contains(candidate) || candidate.contains(existing));
    }

    /**
     * A later content change wins: an embedding that lands after the row moved on is not
     * attached and is left for the janitor.
     */
    void embedInBackground(long ownerId, long itemId, EntityType type, String content) {
        embeddingStore.upsertEmbedding(ownerId, type.sourceType(), itemId, content)
                .publishOn(Schedulers.boundedElastic())
                .map(embeddingId -> knowledgeDao.updateEmbeddingId(ownerId, itemId, embeddingId, content))
                .subscribe(
                        updated -> {
                            if (updated > 0) {
                                log.debug("[knowledge] Embedded {} {} for owner {}", type.code(), itemId, ownerId);
                            } else {
                                log.debug("[knowledge] {} {} changed while embedding, stale embedding dropped", type.code(), itemId);
                            }
                        },
                        e -> log.warn("[knowledge] Embedding failed for {} {} – {}", type.code(), itemId, e.getMessage()));
    }

    private static <T> Mono<T> onOwner(long ownerId, Callable<T> work) {
        if (ownerId <= 0) {
            return Mono.error(new InvalidOwnerException(ownerId));
        }
        return Mono.fromCallable(work).subscribeOn(Schedulers.boundedElastic());
    }

    private static String normalize(String s) {
        return s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
    }

    private static OffsetDateTime now() {
        return OffsetDateTime.now(ZoneOffset.UTC);
    }
}
