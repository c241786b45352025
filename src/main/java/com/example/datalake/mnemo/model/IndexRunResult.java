package com.example.datalake.mnemo.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Counters of one incremental indexing pass.
 */
@Value
@Builder
public class IndexRunResult {

    int filesIndexed;

    int chunksCreated;

    int filesRemoved;

    int filesSkipped;

    int errors;

    /**
     * Another run held the lock; nothing was done.
     */
    boolean alreadyRunning;

    /**
     * Indexing is switched off in configuration; nothing was done.
     */
    boolean disabled;

    Duration elapsed;

    public static IndexRunResult refusedAlreadyRunning() {
        return IndexRunResult.builder().alreadyRunning(true).elapsed(Duration.ZERO).build();
    }

    public static IndexRunResult refusedDisabled() {
        return IndexRunResult.builder().disabled(true).elapsed(Duration.ZERO).build();
    }
}
