package com.example.datalake.mnemo.config;

import com.example.datalake.mnemo.model.FileSearchHit;
import com.example.datalake.mnemo.search.ChunkQuery;
import com.example.datalake.mnemo.search.FallbackSearch;
import com.example.datalake.mnemo.search.KeywordKnowledgeSearch;
import com.example.datalake.mnemo.search.KeywordMode;
import com.example.datalake.mnemo.search.KnowledgeQuery;
import com.example.datalake.mnemo.search.LexicalChunkSearch;
import com.example.datalake.mnemo.search.VectorChunkSearch;
import com.example.datalake.mnemo.search.VectorKnowledgeSearch;
import com.example.datalake.mnemo.util.DatabaseProducts;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.util.List;

/**
 * Similarity first, keywords second.
 */
@Slf4j
@Configuration
public class SearchConfig {

    /**
     * Never {@link KeywordMode#AUTO}: resolved against the database once at startup.
     */
    @Bean
    public KeywordMode keywordMode(DataSource dataSource, MnemoProperties props) {
        KeywordMode requested = props.getKeyword().getMode();
        KeywordMode resolved = requested == KeywordMode.AUTO
                ? (DatabaseProducts.isPostgres(dataSource) ? KeywordMode.FULLTEXT : KeywordMode.LIKE)
                : requested;
        log.info("[keyword] Requested mode {}, using {}", requested, resolved);
        return resolved;
    }

    @Bean
    public FallbackSearch<KnowledgeQuery, Long> knowledgeSearch(VectorKnowledgeSearch vector,
                                                                KeywordKnowledgeSearch keyword) {
        return new FallbackSearch<>("knowledge-search", List.of(vector, keyword));
    }

    @Bean
    public FallbackSearch<ChunkQuery, FileSearchHit> fileChunkSearch(VectorChunkSearch vector,
                                                                     LexicalChunkSearch lexical) {
        return new FallbackSearch<>("file-search", List.of(vector, lexical));
    }
}
