package com.example.datalake.mnemo.dao;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import com.example.datalake.mnemo.model.EntityType;
import com.example.datalake.mnemo.model.GoalStatus;
import com.example.datalake.mnemo.model.KnowledgeItem;
import com.example.datalake.mnemo.model.KnowledgeMetadata;
import com.example.datalake.mnemo.support.H2Databases;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

class JdbcKnowledgeDaoTest {

  private JdbcKnowledgeDao dao;

  @BeforeEach
  void setUp() {
    dao = new JdbcKnowledgeDao(new NamedParameterJdbcTemplate(H2Databases.newDataSource()));
  }

  @Test
  void insertAndFindRoundTripsMetadata() {
    KnowledgeMetadata meta = new KnowledgeMetadata("preference", null, null, Map.of("source", "chat"));
    long id = dao.insert(item(1L, EntityType.FACT, "Prefers dark mode", meta, 0.9));

    KnowledgeItem found = dao.findById(1L, id).orElseThrow();

    assertThat(found.getContent()).isEqualTo("Prefers dark mode");
    assertThat(found.getEntityType()).isEqualTo(EntityType.FACT);
    assertThat(found.getMetadata().category()).isEqualTo("preference");
    assertThat(found.getMetadata().extras()).containsEntry("source", "chat");
    assertThat(found.getConfidence()).isEqualTo(0.9);
    assertThat(found.getEmbeddingId()).isNull();
    assertThat(found.getCreatedAt()).isNotNull();
    assertThat(found.getLastReferencedAt()).isNotNull();
  }

  @Test
  void rowsAreInvisibleToOtherOwners() {
    long id = dao.insert(item(1L, EntityType.FACT, "private", KnowledgeMetadata.empty(), 1.0));

    assertThat(dao.findById(2L, id)).isEmpty();
    assertThat(dao.findByType(2L, EntityType.FACT, 10, 0.0)).isEmpty();
    assertThat(dao.delete(2L, id)).isZero();
    assertThat(dao.findById(1L, id)).isPresent();
  }

  @Test
  void findByTypeFiltersConfidenceAndOrdersNewestFirst() {
    long first = dao.insert(item(1L, EntityType.FACT, "first", KnowledgeMetadata.empty(), 0.9));
    dao.insert(item(1L, EntityType.FACT, "shaky", KnowledgeMetadata.empty(), 0.2));
    long third = dao.insert(item(1L, EntityType.FACT, "third", KnowledgeMetadata.empty(), 0.7));
    dao.insert(item(1L, EntityType.GOAL, "a goal", KnowledgeMetadata.goal(null, GoalStatus.ACTIVE), 1.0));

    List<KnowledgeItem> facts = dao.findByType(1L, EntityType.FACT, 10, 0.5);

    assertThat(facts).extracting(KnowledgeItem::getId).containsExactly(third, first);
  }

  @Test
  void existsWithContentIgnoresCaseAndSurroundingSpace() {
    long id = dao.insert(item(1L, EntityType.LIST_ITEM, "Buy milk", KnowledgeMetadata.empty(), 1.0));

    assertThat(dao.existsWithContent(1L, EntityType.LIST_ITEM, "  buy MILK ", null)).isTrue();
    assertThat(dao.existsWithContent(1L, EntityType.FACT, "buy milk", null)).isFalse();
    assertThat(dao.existsWithContent(1L, EntityType.LIST_ITEM, "buy milk", id)).isFalse();
  }

  @Test
  void sameContentDifferingOnlyInCaseViolatesUniqueKey() {
    dao.insert(item(1L, EntityType.LIST_ITEM, "Buy milk", KnowledgeMetadata.empty(), 1.0));

    assertThatThrownBy(() -> dao.insert(item(1L, EntityType.LIST_ITEM, "  buy MILK ", KnowledgeMetadata.empty(), 1.0)))
        .isInstanceOf(DuplicateKeyException.class);
    dao.insert(item(1L, EntityType.FACT, "Buy milk", KnowledgeMetadata.empty(), 1.0));
    dao.insert(item(2L, EntityType.LIST_ITEM, "Buy milk", KnowledgeMetadata.empty(), 1.0));
  }

  @Test
  void updateRewritesGoalStatusSeenBySearch() {
    long id = dao.insert(item(1L, EntityType.GOAL, "Learn Rust", KnowledgeMetadata.goal("systems", GoalStatus.ACTIVE), 1.0));
    assertThat(dao.searchLexical(1L, EntityType.GOAL, List.of("rust"), 5)).hasSize(1);

    dao.update(1L, id, "Learn Rust", KnowledgeMetadata.goal("systems", GoalStatus.COMPLETED), OffsetDateTime.now(ZoneOffset.UTC));

    KnowledgeItem found = dao.findById(1L, id).orElseThrow();
    assertThat(found.getContent()).isEqualTo("Learn Rust");
    assertThat(found.getMetadata().status()).isEqualTo(GoalStatus.COMPLETED);
    assertThat(dao.searchLexical(1L, EntityType.GOAL, List.of("rust"), 5)).isEmpty();
  }

  @Test
  void updateMovesContentKeyAndSearchText() {
    long id = dao.insert(item(1L, EntityType.FACT, "Owns a bike", KnowledgeMetadata.empty(), 1.0));

    dao.update(1L, id, "Owns a kayak", KnowledgeMetadata.fact("outdoors"), OffsetDateTime.now(ZoneOffset.UTC));

    assertThat(dao.existsWithContent(1L, EntityType.FACT, "owns a bike", null)).isFalse();
    assertThat(dao.existsWithContent(1L, EntityType.FACT, "owns a kayak", null)).isTrue();
    assertThat(dao.searchLexical(1L, EntityType.FACT, List.of("outdoors"), 5))
        .extracting(KnowledgeItem::getId).containsExactly(id);
    assertThat(dao.update(2L, id, "Owns a canoe", KnowledgeMetadata.empty(), OffsetDateTime.now(ZoneOffset.UTC))).isZero();
  }

  @Test
  @SuppressWarnings("unchecked")
  void fullTextSearchRanksWithTsRankOverSearchText() {
    NamedParameterJdbcTemplate jdbc = mock(NamedParameterJdbcTemplate.class);
    ArgumentCaptor<MapSqlParameterSource> params = ArgumentCaptor.forClass(MapSqlParameterSource.class);
    ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);

    new JdbcKnowledgeDao(jdbc).searchFullText(1L, EntityType.GOAL, "\"dark mode\" OR \"tea\"", 4);

    verify(jdbc).query(sql.capture(), params.capture(), any(RowMapper.class));
    assertThat(sql.getValue())
        .contains("to_tsvector('simple', search_text) @@ websearch_to_tsquery('simple', :query)")
        .contains("ORDER BY ts_rank_cd(")
        .contains("status = 'active'");
    assertThat(params.getValue().getValue("query")).isEqualTo("\"dark mode\" OR \"tea\"");
    assertThat(params.getValue().getValue("type")).isEqualTo("goal");
    assertThat(params.getValue().getValue("limit")).isEqualTo(4);
  }

  @Test
  void findByIdsAndTouchReferenced() {
    long a = dao.insert(item(1L, EntityType.FACT, "a", KnowledgeMetadata.empty(), 1.0));
    long b = dao.insert(item(1L, EntityType.FACT, "b", KnowledgeMetadata.empty(), 1.0));
    OffsetDateTime later = OffsetDateTime.now(ZoneOffset.UTC).plusDays(1);

    int touched = dao.touchReferenced(1L, List.of(a), later);

    assertThat(touched).isEqualTo(1);
    assertThat(dao.findByIds(1L, List.of(a, b), 0.0)).hasSize(2);
    assertThat(dao.findById(1L, a).orElseThrow().getLastReferencedAt().toInstant())
        .isEqualTo(later.toInstant());
  }

  @Test
  void updateEmbeddingIdLinksRowOnlyForCurrentContent() {
    long id = dao.insert(item(1L, EntityType.FACT, "linked", KnowledgeMetadata.empty(), 1.0));

    assertThat(dao.updateEmbeddingId(1L, id, 42L, "linked")).isEqualTo(1);
    assertThat(dao.updateEmbeddingId(1L, id, 43L, "an earlier wording")).isZero();

    assertThat(dao.findById(1L, id).orElseThrow().getEmbeddingId()).isEqualTo(42L);
  }

  private static KnowledgeItem item(long owner, EntityType type, String content, KnowledgeMetadata meta, double confidence) {
    return KnowledgeItem.builder()
        .ownerId(owner)
        .entityType(type)
        .content(content)
        .metadata(meta)
        .confidence(confidence)
        .build();
  }
}
