package com.example.datalake.mnemo.indexer;

import com.example.datalake.mnemo.config.MnemoProperties;
import com.example.datalake.mnemo.dao.FileChunkDao;
import com.example.datalake.mnemo.model.FileChunk;
import com.example.datalake.mnemo.model.FileSearchHit;
import com.example.datalake.mnemo.model.IndexRunResult;
import com.example.datalake.mnemo.model.IndexStatus;
import com.example.datalake.mnemo.search.ChunkQuery;
import com.example.datalake.mnemo.search.FallbackSearch;
import com.example.datalake.mnemo.service.EmbeddingStore;
import com.example.datalake.mnemo.util.HomePaths;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Keeps {@code file_chunks} in step with the files under the configured roots.
 *
 * <p>Runs are incremental: a file is re-read only when its modification time moved by a
 * second or more since it was last indexed. Files that vanished or stopped being eligible
 * lose their chunks. Only one run at a time; a second caller gets a result flagged
 * {@code alreadyRunning}.
 */
@Slf4j
@Service
public class FileIndexer {

    static final String FILE_CHUNK_SOURCE = "file_chunk";
    /** File chunks belong to no user; owner ids of real users start at 1. */
    static final long FILE_CHUNK_OWNER = 0L;

    private final FileChunkDao chunkDao;
    private final EmbeddingStore embeddingStore;
    private final FallbackSearch<ChunkQuery, FileSearchHit> fileChunkSearch;
    private final MnemoProperties.Indexer config;
    private final FileEligibility eligibility;
    private final TextChunker chunker;
    private final List<Path> roots;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public FileIndexer(FileChunkDao chunkDao,
                       EmbeddingStore embeddingStore,
                       FallbackSearch<ChunkQuery, FileSearchHit> fileChunkSearch,
                       MnemoProperties properties) {
        this.chunkDao = chunkDao;
        this.embeddingStore = embeddingStore;
        this.fileChunkSearch = fileChunkSearch;
        this.config = properties.getIndexer();
        this.eligibility = new FileEligibility(config);
        this.chunker = new TextChunker(config.getChunkChars(), config.getOverlapChars(), config.getMinChunkChars());
        this.roots = config.getRoots().stream()
                .filter(StringUtils::hasText)
                .map(HomePaths::expand)
                .toList();
    }

    public boolean isRunning() {
        return running.get();
    }

    public Mono<IndexRunResult> runIncremental() {
        if (!config.isEnabled()) {
            return Mono.just(IndexRunResult.refusedDisabled());
        }
        return Mono.defer(() -> {
            if (!running.compareAndSet(false, true)) {
                log.info("[indexer] A run is already in progress, skipping");
                return Mono.just(IndexRunResult.refusedAlreadyRunning());
            }
            log.info("[indexer] Starting incremental file index over {}", roots);
            long started = System.nanoTime();
            RunCounters counters = new RunCounters();

            return Mono.fromCallable(chunkDao::findPathMtimes)
                    .subscribeOn(Schedulers.boundedElastic())
                    .flatMap(indexed -> {
                        Set<String> seen = ConcurrentHashMap.newKeySet();
                        return Mono.fromCallable(this::walkRoots)
                                .subscribeOn(Schedulers.boundedElastic())
                                .flatMapMany(Flux::fromIterable)
                                .concatMap(candidate -> processFile(candidate, indexed, seen, counters))
                                .then(Mono.fromRunnable(() -> removeUnseen(indexed.keySet(), seen, counters))
                                        .subscribeOn(Schedulers.boundedElastic()));
                    })
                    .then(Mono.fromSupplier(() -> counters.toResult(Duration.ofNanos(System.nanoTime() - started))))
                    .doOnNext(result -> log.info(
                            "[indexer] File index complete in {} ms: {} files indexed, {} chunks created, {} files removed, {} skipped, {} errors",
                            result.getElapsed().toMillis(), result.getFilesIndexed(), result.getChunksCreated(),
                            result.getFilesRemoved(), result.getFilesSkipped(), result.getErrors()))
                    .doFinally(signal -> running.set(false));
        });
    }

    /**
     * Similarity search over chunk embeddings, or a token match when similarity search is off
     * or finds nothing.
     *
     * @param pathFilter restricts results to paths under this prefix; {@code ~} is expanded
     */
    public Mono<List<FileSearchHit>> search(String query, int limit, String pathFilter) {
        if (!config.isEnabled() || !StringUtils.hasText(query) || limit <= 0) {
            return Mono.just(List.of());
        }
        String prefix = StringUtils.hasText(pathFilter) ? HomePaths.expand(pathFilter).toString() : null;
        return fileChunkSearch.search(new ChunkQuery(query, prefix, limit));
    }

    public Mono<IndexStatus> getStatus() {
        return Mono.fromCallable(() -> new IndexStatus(
                        chunkDao.countFiles(),
                        chunkDao.countChunks(),
                        chunkDao.lastIndexedAt().orElse(null),
                        roots.stream().map(Path::toString).toList(),
                        config.getExtensions().stream().sorted().toList(),
                        config.isEnabled(),
                        embeddingStore.vectorMode().name().toLowerCase(Locale.ROOT)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private Mono<Void> processFile(Candidate candidate, Map<String, Long> indexed, Set<String> seen, RunCounters counters) {
        String key = candidate.path().toString();
        seen.add(key);

        Long previous = indexed.get(key);
        if (previous != null && Math.abs(previous - candidate.mtimeMillis()) < config.getMtimeTolerance().toMillis()) {
            counters.filesSkipped.incrementAndGet();
            return Mono.empty();
        }

        return indexFile(candidate, counters)
                .doOnNext(created -> {
                    if (created > 0) {
                        counters.filesIndexed.incrementAndGet();
                        counters.chunksCreated.addAndGet(created);
                    }
                })
                .onErrorResume(e -> {
                    log.warn("[indexer] Error indexing {} – {}", key, e.getMessage());
                    counters.errors.incrementAndGet();
                    return Mono.empty();
                })
                .then();
    }

    /**
     * Reads, chunks and stores one file.
     *
     * @return number of chunks written
     */
    private Mono<Integer> indexFile(Candidate candidate, RunCounters counters) {
        String key = candidate.path().toString();
        return Mono.fromCallable(() -> Files.readAllBytes(candidate.path()))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(bytes -> {
                    if (FileEligibility.looksBinary(bytes, config.getBinaryProbeBytes())) {
                        log.debug("[indexer] Skipping binary file {}", key);
                        return dropChunks(key).thenReturn(0);
                    }
                    List<String> chunks = chunker.chunk(new String(bytes, StandardCharsets.UTF_8));
                    if (chunks.isEmpty()) {
                        return dropChunks(key).thenReturn(0);
                    }
                    return Flux.range(0, chunks.size())
                            .concatMap(i -> writeChunk(key, i, chunks.get(i), candidate.mtimeMillis(), counters))
                            .then(Mono.fromCallable(() -> chunkDao.deleteFrom(key, chunks.size()))
                                    .subscribeOn(Schedulers.boundedElastic()))
                            .doOnNext(surplus -> log.debug("[indexer] Indexed {}: {} chunks, {} stale removed",
                                    key, chunks.size(), surplus))
                            .thenReturn(chunks.size());
                });
    }

    /**
     * Embeds the head of the chunk and upserts the row. A chunk whose embedding fails is
     * still stored, without an embedding, so lexical search can find it.
     */
    private Mono<Integer> writeChunk(String path, int index, String text, long mtimeMillis, RunCounters counters) {
        String embedText = text.length() > config.getEmbedPrefixChars()
                ? text.substring(0, config.getEmbedPrefixChars())
                : text;

        return embeddingStore.upsertEmbedding(FILE_CHUNK_OWNER, FILE_CHUNK_SOURCE, null, embedText)
                .map(Optional::of)
                .onErrorResume(e -> {
                    log.warn("[indexer] Embedding failed for chunk {} of {} – {}", index, path, e.getMessage());
                    counters.errors.incrementAndGet();
                    return Mono.just(Optional.empty());
                })
                .publishOn(Schedulers.boundedElastic())
                .map(embeddingId -> {
                    chunkDao.upsert(FileChunk.builder()
                            .path(path)
                            .chunkIndex(index)
                            .contentText(text)
                            .embeddingId(embeddingId.orElse(null))
                            .fileMtime(mtimeMillis)
                            .indexedAt(OffsetDateTime.now(ZoneOffset.UTC))
                            .build());
                    return index;
                });
    }

    private Mono<Integer> dropChunks(String path) {
        return Mono.fromCallable(() -> chunkDao.deleteByPath(path))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private void removeUnseen(Set<String> indexedPaths, Set<String> seen, RunCounters counters) {
        for (String path : indexedPaths) {
            if (seen.contains(path)) {
                continue;
            }
            int deleted = chunkDao.deleteByPath(path);
            if (deleted > 0) {
                counters.filesRemoved.incrementAndGet();
                log.debug("[indexer] Removed {} chunks of vanished or ineligible file {}", deleted, path);
            }
        }
    }

    private List<Candidate> walkRoots() {
        List<Candidate> out = new ArrayList<>();
        for (Path root : roots) {
            if (!Files.isDirectory(root)) {
                log.debug("[indexer] Index root does not exist: {}", root);
                continue;
            }
            walk(root, out);
        }
        return out;
    }

    private void walk(Path root, List<Candidate> out) {
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(root) && !eligibility.shouldDescend(dir)) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile()
                            && eligibility.check(file, attrs.size()) == FileEligibility.Verdict.ELIGIBLE) {
                        out.add(new Candidate(file.toAbsolutePath().normalize(), attrs.lastModifiedTime().toMillis()));
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    log.debug("[indexer] Cannot access {} – {}", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            log.warn("[indexer] Walking {} stopped early – {}", root, e.getMessage());
        }
    }

    private record Candidate(Path path, long mtimeMillis) {
    }

    private static final class RunCounters {
        final AtomicInteger filesIndexed = new AtomicInteger();
        final AtomicInteger chunksCreated = new AtomicInteger();
        final AtomicInteger filesRemoved = new AtomicInteger();
        final AtomicInteger filesSkipped = new AtomicInteger();
        final AtomicInteger errors = new AtomicInteger();

        IndexRunResult toResult(Duration elapsed) {
            return IndexRunResult.builder()
                    .filesIndexed(filesIndexed.get())
                    .chunksCreated(chunksCreated.get())
                    .filesRemoved(filesRemoved.get())
                    .filesSkipped(filesSkipped.get())
                    .errors(errors.get())
                    .elapsed(elapsed)
                    .build();
        }
    }
}
