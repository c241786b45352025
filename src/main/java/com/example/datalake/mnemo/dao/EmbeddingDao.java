package com.example.datalake.mnemo.dao;

import com.example.datalake.mnemo.model.EmbeddingRecord;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface EmbeddingDao {

    long insert(EmbeddingRecord record);

    Optional<EmbeddingRecord> findById(long id);

    /**
     * Embeddings created before {@code createdBefore} that neither a knowledge item nor a file
     * chunk points at any more.
     */
    List<Long> findOrphanIds(OffsetDateTime createdBefore, int limit);

    int deleteByIds(Collection<Long> ids);
}
