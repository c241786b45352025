package com.example.datalake.mnemo.embedding;

import com.example.datalake.mnemo.config.MnemoProperties;
import com.example.datalake.mnemo.exception.EmbeddingException;
import com.example.datalake.mnemo.exception.MemoryException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Turns text into a fixed-length unit vector.
 *
 * <p>The model is built lazily, once per process: the first callers block behind a single
 * initialization (including a warm-up inference) and everybody after that takes the
 * lock-free path. Inference runs on a dedicated bounded scheduler so CPU-heavy encoding
 * never occupies the caller's thread.
 */
@Slf4j
@Component
public class VectorEncoder {

    static final String DISK_FULL_MARKER = "No space left on device";
    private static final String WARMUP_TEXT = "warmup";

    private final EmbeddingModelFactory modelFactory;
    private final CacheDirectoryJanitor cacheJanitor;
    private final int dimension;
    private final Scheduler scheduler;
    private final boolean ownsScheduler;

    private final Object initLock = new Object();
    private volatile EmbeddingModel model;

    @Autowired
    public VectorEncoder(EmbeddingModelFactory modelFactory,
                         CacheDirectoryJanitor cacheJanitor,
                         MnemoProperties properties) {
        this(modelFactory,
                cacheJanitor,
                properties.getEmbedding().getDimension(),
                Schedulers.newParallel("vector-encoder", properties.getEmbedding().getWorkerThreads()),
                true);
    }

    public VectorEncoder(EmbeddingModelFactory modelFactory,
                         CacheDirectoryJanitor cacheJanitor,
                         int dimension,
                         Scheduler scheduler) {
        this(modelFactory, cacheJanitor, dimension, scheduler, false);
    }

    private VectorEncoder(EmbeddingModelFactory modelFactory,
                          CacheDirectoryJanitor cacheJanitor,
                          int dimension,
                          Scheduler scheduler,
                          boolean ownsScheduler) {
        this.modelFactory = modelFactory;
        this.cacheJanitor = cacheJanitor;
        this.dimension = dimension;
        this.scheduler = scheduler;
        this.ownsScheduler = ownsScheduler;
    }

    public Mono<float[]> embed(String text) {
        if (text == null) {
            return Mono.error(new IllegalArgumentException("text must not be null"));
        }
        return Mono.fromCallable(() -> embedWithRecovery(text))
                .subscribeOn(scheduler);
    }

    public int dimension() {
        return dimension;
    }

    public boolean isInitialized() {
        return model != null;
    }

    float[] embedWithRecovery(String text) {
        try {
            return embedOnce(text);
        } catch (MemoryException e) {
            throw e;
        } catch (RuntimeException e) {
            if (!isDiskFull(e)) {
                throw new EmbeddingException("Embedding failed: " + e.getMessage(), e);
            }
            log.warn("[encoder] {} while running the embedding model, purging caches and retrying once", DISK_FULL_MARKER);
            cacheJanitor.purge();
            try {
                return embedOnce(text);
            } catch (RuntimeException retry) {
                throw new EmbeddingException("Embedding failed after cache purge: " + retry.getMessage(), retry);
            }
        }
    }

    private float[] embedOnce(String text) {
        Response<Embedding> response = modelOrInit().embed(text);
        float[] vector = response.content().vector();
        VectorCodec.requireDimension(vector, dimension);
        return VectorCodec.normalize(vector.clone());
    }

    EmbeddingModel modelOrInit() {
        EmbeddingModel current = model;
        if (current != null) {
            return current;
        }
        synchronized (initLock) {
            current = model;
            if (current == null) {
                long started = System.nanoTime();
                current = modelFactory.create();
                // first inference pays for native library loading and graph optimisation
                current.embed(WARMUP_TEXT);
                model = current;
                log.info("[encoder] Embedding model {} ready in {} ms",
                        current.getClass().getSimpleName(), (System.nanoTime() - started) / 1_000_000);
            }
            return current;
        }
    }

    static boolean isDiskFull(Throwable error) {
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Throwable t = error; t != null && seen.add(t); t = t.getCause()) {
            String message = t.getMessage();
            if (message != null && message.contains(DISK_FULL_MARKER)) {
                return true;
            }
        }
        return false;
    }

    @PreDestroy
    public void shutdown() {
        if (ownsScheduler) {
            scheduler.dispose();
        }
    }
}
