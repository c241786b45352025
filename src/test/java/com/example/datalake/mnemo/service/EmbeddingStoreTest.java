package com.example.datalake.mnemo.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.datalake.mnemo.model.SimilarEmbedding;
import com.example.datalake.mnemo.support.MemoryFixture;
import com.example.datalake.mnemo.vector.VectorMode;
import org.junit.jupiter.api.Test;

import java.util.List;

class EmbeddingStoreTest {

  @Test
  void similarTextRanksFirstWithinOwner() {
    MemoryFixture fx = MemoryFixture.withVectorSearch();
    EmbeddingStore store = fx.embeddingStore;
    store.upsertEmbedding(1L, "knowledge_fact", 1L, "uses dark mode everywhere").block();
    store.upsertEmbedding(1L, "knowledge_fact", 2L, "lives near the harbour").block();
    store.upsertEmbedding(2L, "knowledge_fact", 3L, "dark mode fan").block();

    List<SimilarEmbedding> hits = store.searchSimilar(1L, "dark mode", 5).block();

    assertThat(hits).extracting(SimilarEmbedding::sourceId).containsExactly(1L, 2L);
    assertThat(hits.get(0).distance()).isLessThan(hits.get(1).distance());
  }

  @Test
  void typeFilterRestrictsSourceLabel() {
    MemoryFixture fx = MemoryFixture.withVectorSearch();
    EmbeddingStore store = fx.embeddingStore;
    store.upsertEmbedding(1L, "knowledge_fact", 1L, "morning run").block();
    store.upsertEmbedding(1L, "knowledge_goal", 2L, "morning run every day").block();

    List<SimilarEmbedding> hits = store.searchSimilarForType(1L, "morning run", "knowledge_goal", 5, true).block();

    assertThat(hits).extracting(SimilarEmbedding::sourceType).containsOnly("knowledge_goal");
  }

  @Test
  void degenerateQueriesReturnEmpty() {
    EmbeddingStore store = MemoryFixture.withVectorSearch().embeddingStore;

    assertThat(store.searchSimilar(1L, "  ", 5).block()).isEmpty();
    assertThat(store.searchSimilar(1L, "x", 0).block()).isEmpty();
  }

  @Test
  void withoutVectorIndexRowsAreKeptButSearchIsEmpty() {
    MemoryFixture fx = MemoryFixture.withoutVectorSearch();

    Long id = fx.embeddingStore.upsertEmbedding(1L, "knowledge_fact", 1L, "still recorded").block();

    assertThat(fx.embeddingStore.isVectorSearchAvailable()).isFalse();
    assertThat(fx.embeddingStore.vectorMode()).isEqualTo(VectorMode.NONE);
    assertThat(fx.embeddingDao.findById(id)).isPresent();
    assertThat(fx.embeddingStore.searchSimilar(1L, "still recorded", 5).block()).isEmpty();
  }

  @Test
  void removeDropsRowsAndVectors() {
    MemoryFixture fx = MemoryFixture.withVectorSearch();
    Long id = fx.embeddingStore.upsertEmbedding(1L, "knowledge_fact", 1L, "temporary").block();

    assertThat(fx.embeddingStore.remove(List.of(id)).block()).isEqualTo(1);
    assertThat(fx.embeddingDao.findById(id)).isEmpty();
    assertThat(fx.embeddingStore.searchSimilar(1L, "temporary", 5).block()).isEmpty();
  }
}
