package com.example.datalake.mnemo.config;

import com.example.datalake.mnemo.util.DatabaseProducts;
import com.example.datalake.mnemo.vector.DisabledVectorIndex;
import com.example.datalake.mnemo.vector.ExactScanVectorIndex;
import com.example.datalake.mnemo.vector.PgVectorIndex;
import com.example.datalake.mnemo.vector.VectorIndex;
import com.example.datalake.mnemo.vector.VectorMode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import javax.sql.DataSource;

/**
 * Chooses the vector index once at startup. Whatever is picked here stays for the process
 * lifetime; an unusable pgvector turns similarity search off instead of failing startup.
 */
@Slf4j
@Configuration
public class VectorIndexConfig {

    @Bean
    public VectorIndex vectorIndex(DataSource dataSource,
                                   NamedParameterJdbcTemplate jdbcTemplate,
                                   MnemoProperties props) {
        VectorMode requested = props.getVector().getMode();
        int dimension = props.getEmbedding().getDimension();

        VectorIndex index = switch (requested) {
            case NONE -> new DisabledVectorIndex();
            case EXACT -> new ExactScanVectorIndex(jdbcTemplate, dimension);
            case PGVECTOR -> pgvectorOrDisabled(jdbcTemplate, dimension);
            case AUTO -> DatabaseProducts.isPostgres(dataSource)
                    ? pgvectorOrDisabled(jdbcTemplate, dimension)
                    : new DisabledVectorIndex();
        };

        log.info("[vector] Requested mode {}, using {} (similarity search {})",
                requested, index.mode(), index.isAvailable() ? "on" : "off, keyword fallback only");
        return index;
    }

    private VectorIndex pgvectorOrDisabled(NamedParameterJdbcTemplate jdbcTemplate, int dimension) {
        PgVectorIndex pg = new PgVectorIndex(jdbcTemplate, dimension);
        return pg.initialize() ? pg : new DisabledVectorIndex();
    }
}
