package com.flamingo.ai.librarychat.config;

import com.flamingo.ai.librarychat.service.generation.OpenAiStreamingModelProvider;
import com.flamingo.ai.librarychat.service.generation.StreamingModelProvider;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for LangChain4j models. */
@Configuration
public class LangChain4jConfig {

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.embedding-model.model-name:text-embedding-ada-002}")
  private String embeddingModelName;

  @Bean
  public EmbeddingModel embeddingModel(ChatProperties chatProperties) {
    validateApiKey();

    return OpenAiEmbeddingModel.builder()
        .apiKey(openAiApiKey)
        .modelName(embeddingModelName)
        .dimensions(chatProperties.getRetrieval().getVectorDimensions())
        .timeout(Duration.ofSeconds(30))
        .build();
  }

  /**
   * Streaming models are built per (model, temperature) pair because comparison requests choose
   * both at request time.
   */
  @Bean
  public StreamingModelProvider streamingModelProvider(ChatProperties chatProperties) {
    return new OpenAiStreamingModelProvider(
        openAiApiKey, chatProperties.getGeneration().getTimeout());
  }

  private void validateApiKey() {
    if (openAiApiKey == null || openAiApiKey.isBlank()) {
      throw new IllegalStateException(
          "OpenAI API key is required. Set OPENAI_API_KEY environment variable.");
    }
  }
}
