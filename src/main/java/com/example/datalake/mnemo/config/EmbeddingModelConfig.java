package com.example.datalake.mnemo.config;

import com.example.datalake.mnemo.embedding.EmbeddingModelFactory;
import dev.langchain4j.model.embedding.onnx.allminilml6v2.AllMiniLmL6V2EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class EmbeddingModelConfig {

    @Bean
    public EmbeddingModelFactory embeddingModelFactory(MnemoProperties props) {
        MnemoProperties.Embedding cfg = props.getEmbedding();

        if ("openai".equalsIgnoreCase(cfg.getProvider())) {
            // Without a key the local model keeps memory working offline
            if (cfg.getApiKey() == null || cfg.getApiKey().isBlank()) {
                log.warn("[encoder] mnemo.embedding.provider=openai but no api key is set, using the local model");
            } else {
                return () -> OpenAiEmbeddingModel.builder()
                        .apiKey(cfg.getApiKey())
                        .modelName(cfg.getOpenAiModel())
                        .dimensions(cfg.getDimension())
                        .build();
            }
        }

        return AllMiniLmL6V2EmbeddingModel::new;
    }
}
