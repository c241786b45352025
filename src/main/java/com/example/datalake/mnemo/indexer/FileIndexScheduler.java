package com.example.datalake.mnemo.indexer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "mnemo.indexer.enabled", havingValue = "true", matchIfMissing = true)
public class FileIndexScheduler {

    private final FileIndexer fileIndexer;

    @Scheduled(cron = "${mnemo.indexer.cron:0 0 3 * * *}")
    public void scheduledRun() {
        fileIndexer.runIncremental()
                .subscribe(
                        result -> log.debug("[indexer] Scheduled run finished: {}", result),
                        e -> log.warn("[indexer] Scheduled run failed – {}", e.getMessage()));
    }
}
