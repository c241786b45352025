package com.example.datalake.mnemo.dao;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.datalake.mnemo.model.EmbeddingRecord;
import com.example.datalake.mnemo.model.EntityType;
import com.example.datalake.mnemo.model.FileChunk;
import com.example.datalake.mnemo.model.KnowledgeItem;
import com.example.datalake.mnemo.support.H2Databases;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

class JdbcEmbeddingDaoTest {

  private JdbcEmbeddingDao embeddingDao;
  private JdbcKnowledgeDao knowledgeDao;
  private JdbcFileChunkDao fileChunkDao;

  @BeforeEach
  void setUp() {
    NamedParameterJdbcTemplate jdbc = new NamedParameterJdbcTemplate(H2Databases.newDataSource());
    embeddingDao = new JdbcEmbeddingDao(jdbc);
    knowledgeDao = new JdbcKnowledgeDao(jdbc);
    fileChunkDao = new JdbcFileChunkDao(jdbc);
  }

  @Test
  void orphansAreThoseNothingReferences() {
    OffsetDateTime old = OffsetDateTime.now(ZoneOffset.UTC).minusDays(1);
    long referencedByKnowledge = insert("fact", old);
    long referencedByChunk = insert("chunk", old);
    long orphan = insert("orphan", old);
    long freshOrphan = insert("fresh", OffsetDateTime.now(ZoneOffset.UTC));

    knowledgeDao.insert(KnowledgeItem.builder().ownerId(1L).entityType(EntityType.FACT)
        .content("fact").embeddingId(referencedByKnowledge).build());
    fileChunkDao.upsert(FileChunk.builder().path("/a.md").chunkIndex(0).contentText("chunk")
        .embeddingId(referencedByChunk).fileMtime(1L).build());

    List<Long> orphans = embeddingDao.findOrphanIds(OffsetDateTime.now(ZoneOffset.UTC).minusHours(1), 10);

    assertThat(orphans).containsExactly(orphan).doesNotContain(freshOrphan);
    assertThat(embeddingDao.deleteByIds(orphans)).isEqualTo(1);
    assertThat(embeddingDao.findById(orphan)).isEmpty();
  }

  private long insert(String text, OffsetDateTime createdAt) {
    return embeddingDao.insert(EmbeddingRecord.builder()
        .ownerId(1L)
        .sourceType("knowledge_fact")
        .contentText(text)
        .modelName("test")
        .createdAt(createdAt)
        .build());
  }
}
