package com.gdin.inspection.erpvector.config;

import com.gdin.inspection.erpvector.config.properties.EmbeddingProperties;
import com.gdin.inspection.erpvector.embedding.EmbeddingService;
import com.gdin.inspection.erpvector.embedding.LangchainEmbeddingService;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.ollama.OllamaEmbeddingModel;
import jakarta.annotation.Resource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class AIConfig {
    @Resource
    private EmbeddingProperties embeddingProperties;

    @Bean
    public EmbeddingModel embeddingModel() {
        return OllamaEmbeddingModel.builder()
                .baseUrl(embeddingProperties.getBaseUrl())
                .modelName(embeddingProperties.getModelName())
                .timeout(Duration.ofSeconds(embeddingProperties.getTimeoutSeconds()))
                .build();
    }

    @Bean
    public EmbeddingService embeddingService(EmbeddingModel embeddingModel) {
        return new LangchainEmbeddingService(embeddingModel,
                embeddingProperties.getDocumentPrefix(),
                embeddingProperties.getQueryPrefix(),
                embeddingProperties.getBatchSize());
    }
}
