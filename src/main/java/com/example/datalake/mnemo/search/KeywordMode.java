package com.example.datalake.mnemo.search;

/**
 * Which engine answers keyword queries.
 */
public enum KeywordMode {
    /** Full text on PostgreSQL, LIKE elsewhere. */
    AUTO,
    /** PostgreSQL {@code tsvector} match ranked by {@code ts_rank_cd}. */
    FULLTEXT,
    /** Substring match of each phrase, ranked by how many phrases hit. */
    LIKE
}
