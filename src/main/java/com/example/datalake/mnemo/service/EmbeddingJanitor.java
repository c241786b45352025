package com.example.datalake.mnemo.service;

import com.example.datalake.mnemo.config.MnemoProperties;
import com.example.datalake.mnemo.dao.EmbeddingDao;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Removes embeddings nothing points at any more: those superseded by a content update,
 * left behind by deleted knowledge, or replaced when a file was re-indexed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EmbeddingJanitor {

    static final int BATCH_SIZE = 500;

    private final EmbeddingDao embeddingDao;
    private final EmbeddingStore embeddingStore;
    private final MnemoProperties properties;

    @Scheduled(cron = "${mnemo.janitor.cron:0 30 4 * * *}")
    public void scheduledSweep() {
        if (!properties.getJanitor().isEnabled()) {
            return;
        }
        sweep().subscribe(
                removed -> log.debug("[janitor] Scheduled sweep removed {} embeddings", removed),
                e -> log.warn("[janitor] Scheduled sweep failed – {}", e.getMessage()));
    }

    /**
     * @return number of embedding rows removed
     */
    public Mono<Integer> sweep() {
        OffsetDateTime cutoff = OffsetDateTime.now(ZoneOffset.UTC).minus(properties.getJanitor().getGrace());
        return sweepBatch(cutoff)
                .expand(removed -> removed >= BATCH_SIZE ? sweepBatch(cutoff) : Mono.empty())
                .reduce(0, Integer::sum)
                .doOnNext(total -> log.info("[janitor] Removed {} orphaned embeddings older than {}", total, cutoff));
    }

    private Mono<Integer> sweepBatch(OffsetDateTime cutoff) {
        return Mono.fromCallable(() -> embeddingDao.findOrphanIds(cutoff, BATCH_SIZE))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(ids -> ids.isEmpty() ? Mono.just(0) : embeddingStore.remove(ids));
    }
}
