package com.example.datalake.mnemo.indexer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.example.datalake.mnemo.exception.EmbeddingException;
import com.example.datalake.mnemo.model.FileChunk;
import com.example.datalake.mnemo.model.FileSearchHit;
import com.example.datalake.mnemo.model.IndexRunResult;
import com.example.datalake.mnemo.model.IndexStatus;
import com.example.datalake.mnemo.service.EmbeddingStore;
import com.example.datalake.mnemo.support.MemoryFixture;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.util.List;

class FileIndexerTest {

  @TempDir
  Path root;

  @Test
  void indexesNotesAndLeavesSensitiveFilesOut() throws IOException {
    MemoryFixture fx = MemoryFixture.withVectorSearch();
    Path notes = write("notes.md", prose(600));
    write("secret/.env", "API_KEY=abc123");

    IndexRunResult result = indexer(fx).runIncremental().block();

    assertThat(result.getFilesIndexed()).isEqualTo(1);
    assertThat(result.getErrors()).isZero();
    assertThat(fx.fileChunkDao.findByPath(key(notes))).hasSizeGreaterThanOrEqualTo(1)
        .allSatisfy(c -> assertThat(c.getEmbeddingId()).isNotNull());
    assertThat(fx.fileChunkDao.findPathMtimes().keySet()).noneMatch(p -> p.contains(".env"));
  }

  @Test
  void unchangedFileIsSkippedOnSecondRun() throws IOException {
    MemoryFixture fx = MemoryFixture.withVectorSearch();
    write("notes.md", prose(600));
    FileIndexer indexer = indexer(fx);
    indexer.runIncremental().block();

    IndexRunResult second = indexer.runIncremental().block();

    assertThat(second.getFilesIndexed()).isZero();
    assertThat(second.getFilesSkipped()).isEqualTo(1);
    assertThat(second.getChunksCreated()).isZero();
  }

  @Test
  void shrinkingFileLeavesOnlyCurrentChunks() throws IOException {
    MemoryFixture fx = MemoryFixture.withVectorSearch();
    Path doc = write("long.txt", prose(5000));
    FileIndexer indexer = indexer(fx);
    indexer.runIncremental().block();
    assertThat(fx.fileChunkDao.findByPath(key(doc)).size()).isGreaterThan(1);

    FileTime before = Files.getLastModifiedTime(doc);
    Files.writeString(doc, prose(600));
    Files.setLastModifiedTime(doc, FileTime.fromMillis(before.toMillis() + 5_000));
    IndexRunResult rerun = indexer.runIncremental().block();

    assertThat(rerun.getFilesIndexed()).isEqualTo(1);
    assertThat(fx.fileChunkDao.findByPath(key(doc))).extracting(FileChunk::getChunkIndex).containsExactly(0);
  }

  @Test
  void sensitiveOversizedAndBinaryFilesAreNeverIndexed() throws IOException {
    MemoryFixture fx = MemoryFixture.withVectorSearch();
    fx.properties.getIndexer().setMaxFileBytes(2_000);
    write("app/credentials.txt", prose(300));
    write("big.md", prose(3_000));
    Path binary = root.resolve("blob.txt");
    byte[] bytes = prose(300).getBytes();
    bytes[10] = 0;
    Files.write(binary, bytes);
    write("node_modules/pkg/readme.md", prose(300));
    write(".hidden/diary.md", prose(300));
    Path kept = write("kept.md", prose(300));

    indexer(fx).runIncremental().block();

    assertThat(fx.fileChunkDao.findPathMtimes().keySet()).containsExactly(key(kept));
  }

  @Test
  void fileThatTurnsBinaryLosesItsChunks() throws IOException {
    MemoryFixture fx = MemoryFixture.withVectorSearch();
    Path doc = write("data.txt", prose(300));
    FileIndexer indexer = indexer(fx);
    indexer.runIncremental().block();

    FileTime before = Files.getLastModifiedTime(doc);
    byte[] bytes = prose(300).getBytes();
    bytes[0] = 0;
    Files.write(doc, bytes);
    Files.setLastModifiedTime(doc, FileTime.fromMillis(before.toMillis() + 5_000));
    indexer.runIncremental().block();

    assertThat(fx.fileChunkDao.findByPath(key(doc))).isEmpty();
  }

  @Test
  void deletedFileIsRemovedFromIndex() throws IOException {
    MemoryFixture fx = MemoryFixture.withVectorSearch();
    Path doc = write("gone.md", prose(300));
    FileIndexer indexer = indexer(fx);
    indexer.runIncremental().block();

    Files.delete(doc);
    IndexRunResult rerun = indexer.runIncremental().block();

    assertThat(rerun.getFilesRemoved()).isEqualTo(1);
    assertThat(fx.fileChunkDao.findByPath(key(doc))).isEmpty();
  }

  @Test
  void failedEmbeddingStillStoresChunkAndCountsError() throws IOException {
    MemoryFixture fx = MemoryFixture.withoutVectorSearch();
    EmbeddingStore failing = mock(EmbeddingStore.class);
    when(failing.upsertEmbedding(anyLong(), anyString(), any(), anyString()))
        .thenReturn(Mono.error(new EmbeddingException("model unavailable")));
    Path doc = write("notes.md", prose(600));
    fx.properties.getIndexer().setRoots(List.of(root.toString()));
    FileIndexer indexer = new FileIndexer(fx.fileChunkDao, failing, fx.fileChunkSearch, fx.properties);

    IndexRunResult result = indexer.runIncremental().block();

    assertThat(result.getErrors()).isEqualTo(1);
    assertThat(result.getFilesIndexed()).isEqualTo(1);
    assertThat(fx.fileChunkDao.findByPath(key(doc))).singleElement()
        .satisfies(c -> assertThat(c.getEmbeddingId()).isNull());
  }

  @Test
  void secondRunWhileFirstIsActiveIsRefused() throws IOException {
    MemoryFixture fx = MemoryFixture.withoutVectorSearch();
    EmbeddingStore stuck = mock(EmbeddingStore.class);
    when(stuck.upsertEmbedding(anyLong(), anyString(), any(), anyString())).thenReturn(Mono.never());
    write("notes.md", prose(600));
    fx.properties.getIndexer().setRoots(List.of(root.toString()));
    FileIndexer indexer = new FileIndexer(fx.fileChunkDao, stuck, fx.fileChunkSearch, fx.properties);

    Disposable first = indexer.runIncremental().subscribe();
    IndexRunResult second = indexer.runIncremental().block();
    first.dispose();

    assertThat(second.isAlreadyRunning()).isTrue();
    MemoryFixture.awaitTrue(() -> !indexer.isRunning(), Duration.ofSeconds(5));
  }

  @Test
  void disabledIndexerDoesNothing() throws IOException {
    MemoryFixture fx = MemoryFixture.withVectorSearch();
    write("notes.md", prose(600));
    fx.properties.getIndexer().setEnabled(false);

    IndexRunResult result = indexer(fx).runIncremental().block();

    assertThat(result.isDisabled()).isTrue();
    assertThat(fx.fileChunkDao.countChunks()).isZero();
  }

  @Test
  void searchUsesSimilarityWhenAvailable() throws IOException {
    MemoryFixture fx = MemoryFixture.withVectorSearch();
    write("bread.md", "Sourdough starter needs feeding twice a day with flour and water. " + prose(200));
    FileIndexer indexer = indexer(fx);
    indexer.runIncremental().block();

    List<FileSearchHit> hits = indexer.search("sourdough starter", 5, null).block();

    assertThat(hits).isNotEmpty();
    assertThat(hits.get(0).distance()).isNotNull();
    assertThat(hits.get(0).path()).endsWith("bread.md");
  }

  @Test
  void searchFallsBackToLexicalMatchAndHonoursPathFilter() throws IOException {
    MemoryFixture fx = MemoryFixture.withoutVectorSearch();
    write("kitchen/bread.md", "Sourdough starter needs feeding twice a day. " + prose(200));
    write("garage/bike.md", "Chain lube every 300 km or so. " + prose(200));
    FileIndexer indexer = indexer(fx);
    indexer.runIncremental().block();

    List<FileSearchHit> hits = indexer.search("sourdough", 5, null).block();
    List<FileSearchHit> filtered = indexer.search("sourdough", 5, root.resolve("garage").toString()).block();

    assertThat(hits).singleElement().satisfies(h -> {
      assertThat(h.path()).endsWith("bread.md");
      assertThat(h.distance()).isNull();
    });
    assertThat(filtered).isEmpty();
  }

  @Test
  void statusReportsCounts() throws IOException {
    MemoryFixture fx = MemoryFixture.withVectorSearch();
    write("a.md", prose(300));
    write("b.md", prose(300));
    FileIndexer indexer = indexer(fx);
    indexer.runIncremental().block();

    IndexStatus status = indexer.getStatus().block();

    assertThat(status.fileCount()).isEqualTo(2);
    assertThat(status.chunkCount()).isEqualTo(2);
    assertThat(status.lastIndexedAt()).isNotNull();
    assertThat(status.vectorMode()).isEqualTo("exact");
    assertThat(status.roots()).containsExactly(root.toAbsolutePath().normalize().toString());
  }

  private FileIndexer indexer(MemoryFixture fx) {
    fx.properties.getIndexer().setRoots(List.of(root.toString()));
    return new FileIndexer(fx.fileChunkDao, fx.embeddingStore, fx.fileChunkSearch, fx.properties);
  }

  private Path write(String relative, String content) throws IOException {
    Path file = root.resolve(relative);
    Files.createDirectories(file.getParent());
    Files.writeString(file, content);
    return file;
  }

  private static String key(Path file) {
    return file.toAbsolutePath().normalize().toString();
  }

  /** Plain sentences, exactly {@code length} characters. */
  private static String prose(int length) {
    String sentence = "The quick brown fox jumps over the lazy dog near the river bank. ";
    StringBuilder sb = new StringBuilder();
    while (sb.length() < length) {
      sb.append(sentence);
    }
    return sb.substring(0, length);
  }
}
