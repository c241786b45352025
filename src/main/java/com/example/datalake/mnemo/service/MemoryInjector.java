package com.example.datalake.mnemo.service;

import com.example.datalake.mnemo.config.MnemoProperties;
import com.example.datalake.mnemo.exception.InvalidOwnerException;
import com.example.datalake.mnemo.model.EntityType;
import com.example.datalake.mnemo.model.GoalStatus;
import com.example.datalake.mnemo.model.KnowledgeItem;
import com.example.datalake.mnemo.search.FallbackSearch;
import com.example.datalake.mnemo.search.KnowledgeQuery;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Objects;

/**
 * Builds the memory block injected into the assistant's system prompt.
 *
 * <p>Per entity type the most relevant items come from similarity search, then keyword
 * search, and when neither finds anything, the most recent items. Items that make it into
 * the block are marked as referenced.
 */
@Slf4j
@Service
public class MemoryInjector {

    private static final int GOAL_OVERFETCH = 3;

    private final KnowledgeStore knowledgeStore;
    private final FallbackSearch<KnowledgeQuery, Long> knowledgeSearch;
    private final ProjectContextReader projectContextReader;
    private final MnemoProperties.Context config;
    private final MemoryBlockRenderer renderer = new MemoryBlockRenderer();

    public MemoryInjector(KnowledgeStore knowledgeStore,
                          FallbackSearch<KnowledgeQuery, Long> knowledgeSearch,
                          ProjectContextReader projectContextReader,
                          MnemoProperties properties) {
        this.knowledgeStore = knowledgeStore;
        this.knowledgeSearch = knowledgeSearch;
        this.projectContextReader = projectContextReader;
        this.config = properties.getContext();
    }

    public Mono<String> buildContext(long ownerId, String message) {
        return buildContext(ownerId, message, config.getMinConfidence());
    }

    /**
     * @return the rendered block, or an empty string when there is nothing worth injecting
     */
    public Mono<String> buildContext(long ownerId, String message, double minConfidence) {
        if (ownerId <= 0) {
            return Mono.error(new InvalidOwnerException(ownerId));
        }
        String text = message == null ? "" : message;

        return Mono.zip(
                        relevant(ownerId, text, EntityType.FACT, config.getFactLimit(), minConfidence),
                        relevant(ownerId, text, EntityType.GOAL, config.getGoalLimit(), minConfidence),
                        relevant(ownerId, text, EntityType.LIST_ITEM, config.getListItemLimit(), minConfidence),
                        projectContext(ownerId))
                .map(t -> renderer.render(t.getT1(), t.getT2(), t.getT3(), t.getT4()))
                .onErrorResume(e -> {
                    log.warn("[injector] Memory retrieval failed for owner {} – {}", ownerId, e.getMessage());
                    return Mono.just("");
                });
    }

    public Mono<String> buildSystemPrompt(long ownerId, String message, String baseText) {
        return buildSystemPrompt(ownerId, message, baseText, config.getMinConfidence());
    }

    /**
     * {@code baseText} unchanged when there is no memory to add, otherwise base text, a blank
     * line and the memory block.
     */
    public Mono<String> buildSystemPrompt(long ownerId, String message, String baseText, double minConfidence) {
        String base = baseText == null ? "" : baseText;
        return buildContext(ownerId, message, minConfidence)
                .map(block -> {
                    String full = block.isEmpty() ? base : base + "\n\n" + block;
                    log.debug("[injector] System prompt: {} tokens (base: {}, memory: {})",
                            estimateTokens(full), estimateTokens(base), estimateTokens(block));
                    return full;
                });
    }

    private Mono<List<KnowledgeItem>> relevant(long ownerId, String message, EntityType type, int limit, double minConfidence) {
        if (limit <= 0) {
            return Mono.just(List.of());
        }
        return knowledgeSearch.search(new KnowledgeQuery(ownerId, type, message, limit))
                .flatMap(ids -> ids.isEmpty()
                        ? knowledgeStore.getByType(ownerId, type, type == EntityType.GOAL ? limit * GOAL_OVERFETCH : limit, minConfidence)
                        : knowledgeStore.getByIds(ownerId, ids, minConfidence))
                .map(items -> type == EntityType.GOAL ? activeGoals(items, limit) : items)
                .flatMap(items -> markReferenced(ownerId, items).thenReturn(items));
    }

    private Mono<Integer> markReferenced(long ownerId, List<KnowledgeItem> items) {
        List<Long> ids = items.stream().map(KnowledgeItem::getId).filter(Objects::nonNull).toList();
        return knowledgeStore.touchReferenced(ownerId, ids)
                .onErrorResume(e -> {
                    log.debug("[injector] Could not mark items referenced – {}", e.getMessage());
                    return Mono.just(0);
                });
    }

    private Mono<List<String>> projectContext(long ownerId) {
        if (config.getMaxProjects() <= 0) {
            return Mono.just(List.of());
        }
        return knowledgeStore.getByType(ownerId, EntityType.FACT, Integer.MAX_VALUE, 0.0)
                .map(facts -> facts.stream()
                        .filter(f -> config.getProjectCategory().equals(f.getMetadata().category()))
                        .map(KnowledgeItem::getContent)
                        .limit(config.getMaxProjects())
                        .toList())
                .flatMap(projectContextReader::read)
                .onErrorResume(e -> {
                    log.debug("[injector] Project context unavailable – {}", e.getMessage());
                    return Mono.just(List.of());
                });
    }

    private static List<KnowledgeItem> activeGoals(List<KnowledgeItem> goals, int limit) {
        return goals.stream()
                .filter(g -> g.getMetadata().effectiveStatus() == GoalStatus.ACTIVE)
                .limit(limit)
                .toList();
    }

    /**
     * Rough count, about four characters per token.
     */
    static int estimateTokens(String text) {
        return text == null || text.isEmpty() ? 0 : Math.max(1, text.length() / 4);
    }
}
