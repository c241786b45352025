package com.example.datalake.mnemo.embedding;

import dev.langchain4j.model.embedding.EmbeddingModel;

/**
 * Builds the embedding model. Called at most once per process by {@link VectorEncoder}.
 */
@FunctionalInterface
public interface EmbeddingModelFactory {

    EmbeddingModel create();
}
