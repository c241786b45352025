package com.example.datalake.mnemo.vector;

/**
 * Which vector index backs similarity search.
 */
public enum VectorMode {
    /** pgvector when the database supports it, otherwise none. */
    AUTO,
    /** PostgreSQL vector extension with {@code <->} ordering. */
    PGVECTOR,
    /** Packed float32 blobs, exact distance computed in the JVM. */
    EXACT,
    /** No vector search; callers fall back to keyword search. */
    NONE
}
