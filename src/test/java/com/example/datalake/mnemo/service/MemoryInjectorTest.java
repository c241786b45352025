package com.example.datalake.mnemo.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.datalake.mnemo.exception.InvalidOwnerException;
import com.example.datalake.mnemo.model.EntityType;
import com.example.datalake.mnemo.model.GoalStatus;
import com.example.datalake.mnemo.model.KnowledgeItem;
import com.example.datalake.mnemo.model.KnowledgeMetadata;
import com.example.datalake.mnemo.support.MemoryFixture;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

class MemoryInjectorTest {

  @TempDir
  Path tmp;

  @Test
  void keywordFallbackFindsFactWhenVectorSearchIsOff() {
    MemoryFixture fx = MemoryFixture.withoutVectorSearch();
    fx.knowledgeStore.addItem(1L, EntityType.FACT, "Uses dark mode UI", KnowledgeMetadata.fact("preference")).block();

    String block = injector(fx).buildContext(1L, "dark mode").block();

    assertThat(block).isNotEmpty();
    assertThat(block).contains("Uses dark mode UI");
    assertThat(block).startsWith("<memory>").endsWith("</memory>");
  }

  @Test
  void emptyMemoryLeavesBaseTextUntouched() {
    MemoryFixture fx = MemoryFixture.withoutVectorSearch();

    String prompt = injector(fx).buildSystemPrompt(1L, "hello there", "BASE").block();

    assertThat(prompt).isEqualTo("BASE");
  }

  @Test
  void memoryIsAppendedAfterBlankLine() {
    MemoryFixture fx = MemoryFixture.withoutVectorSearch();
    fx.knowledgeStore.addItem(1L, EntityType.LIST_ITEM, "Buy oat milk", KnowledgeMetadata.listItem("groceries")).block();

    String prompt = injector(fx).buildSystemPrompt(1L, "what is on my list?", "BASE").block();

    assertThat(prompt).startsWith("BASE\n\n<memory>");
    assertThat(prompt).contains("<item id=").contains("Buy oat milk");
  }

  @Test
  void noKeywordHitFallsBackToRecentItems() {
    MemoryFixture fx = MemoryFixture.withoutVectorSearch();
    fx.knowledgeStore.addItem(1L, EntityType.FACT, "Born in Porto", null).block();

    String block = injector(fx).buildContext(1L, "zzz unrelated", 0.5).block();

    assertThat(block).contains("Born in Porto").contains("category='general'");
  }

  @Test
  void inactiveGoalsAndLowConfidenceFactsAreLeftOut() {
    MemoryFixture fx = MemoryFixture.withoutVectorSearch();
    long done = fx.knowledgeStore.addItem(1L, EntityType.GOAL, "Ship the beta", null).block();
    fx.knowledgeStore.update(1L, done, null, KnowledgeMetadata.goal(null, GoalStatus.COMPLETED)).block();
    fx.knowledgeStore.addItem(1L, EntityType.GOAL, "Learn to sail", KnowledgeMetadata.goal("before summer", null)).block();
    fx.knowledgeStore.addItem(1L, EntityType.FACT, "Might like jazz", null, 0.3).block();

    String block = injector(fx).buildContext(1L, "anything").block();

    assertThat(block).contains("Learn to sail — before summer");
    assertThat(block).doesNotContain("Ship the beta").doesNotContain("Might like jazz");
  }

  @Test
  void otherOwnersMemoryNeverLeaks() {
    MemoryFixture fx = MemoryFixture.withVectorSearch();
    fx.knowledgeStore.addItem(2L, EntityType.FACT, "Secret fact about owner two", null).block();

    assertThat(injector(fx).buildContext(1L, "secret fact").block()).isEmpty();
  }

  @Test
  void vectorPathRanksSimilarFactFirst() {
    MemoryFixture fx = MemoryFixture.withVectorSearch();
    long tea = fx.knowledgeStore.addItem(1L, EntityType.FACT, "drinks green tea daily", null).block();
    long dog = fx.knowledgeStore.addItem(1L, EntityType.FACT, "walks the dog at noon", null).block();
    MemoryFixture.awaitTrue(() -> embedded(fx, tea) && embedded(fx, dog), Duration.ofSeconds(5));

    String block = injector(fx).buildContext(1L, "green tea").block();

    assertThat(block.indexOf("green tea")).isLessThan(block.indexOf("walks the dog"));
  }

  @Test
  void surfacedItemsAreMarkedReferenced() {
    MemoryFixture fx = MemoryFixture.withoutVectorSearch();
    long id = fx.knowledgeStore.addItem(1L, EntityType.FACT, "Plays chess", null).block();
    KnowledgeItem before = fx.knowledgeDao.findById(1L, id).orElseThrow();

    injector(fx).buildContext(1L, "chess").block();

    KnowledgeItem after = fx.knowledgeDao.findById(1L, id).orElseThrow();
    assertThat(after.getLastReferencedAt()).isAfterOrEqualTo(before.getLastReferencedAt());
  }

  @Test
  void projectReadmeIsIncludedForProjectFacts() throws IOException {
    MemoryFixture fx = MemoryFixture.withoutVectorSearch();
    Path project = Files.createDirectories(tmp.resolve("garden-planner"));
    Files.writeString(project.resolve("README.md"), "Garden planner tracks seedlings & harvests.");
    fx.knowledgeStore.addItem(1L, EntityType.FACT, project.toString(), KnowledgeMetadata.fact("project")).block();

    String block = injector(fx).buildContext(1L, "how are my seedlings").block();

    assertThat(block).contains("category='project_context'")
        .contains("Garden planner tracks seedlings &amp; harvests.");
  }

  @Test
  void invalidOwnerIsRejected() {
    MemoryFixture fx = MemoryFixture.withoutVectorSearch();

    assertThatThrownBy(() -> injector(fx).buildContext(0L, "hi").block())
        .isInstanceOf(InvalidOwnerException.class);
  }

  private static boolean embedded(MemoryFixture fx, long id) {
    return fx.knowledgeDao.findById(1L, id).map(KnowledgeItem::getEmbeddingId).isPresent();
  }

  private static MemoryInjector injector(MemoryFixture fx) {
    return new MemoryInjector(fx.knowledgeStore, fx.knowledgeSearch, new ProjectContextReader(fx.properties), fx.properties);
  }
}
