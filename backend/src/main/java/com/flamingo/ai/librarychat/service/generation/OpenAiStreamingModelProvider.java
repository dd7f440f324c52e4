package com.flamingo.ai.librarychat.service.generation;

import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.openai.OpenAiStreamingChatModel;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds OpenAI streaming models on demand and keeps one per settings pair.
 *
 * <p>Comparison requests pick models at request time, so models cannot all be created at startup.
 */
@Slf4j
public class OpenAiStreamingModelProvider implements StreamingModelProvider {

  private final String apiKey;
  private final Duration timeout;
  private final Map<ModelSettings, StreamingChatModel> models = new ConcurrentHashMap<>();

  public OpenAiStreamingModelProvider(String apiKey, Duration timeout) {
    this.apiKey = apiKey;
    this.timeout = timeout;
  }

  @Override
  public StreamingChatModel modelFor(ModelSettings settings) {
    return models.computeIfAbsent(settings, this::build);
  }

  private StreamingChatModel build(ModelSettings settings) {
    if (apiKey == null || apiKey.isBlank()) {
      throw new IllegalStateException(
          "OpenAI API key is required. Set OPENAI_API_KEY environment variable.");
    }
    log.info(
        "Creating streaming model {} (temperature={})",
        settings.modelName(),
        settings.temperature());
    return OpenAiStreamingChatModel.builder()
        .apiKey(apiKey)
        .modelName(settings.modelName())
        .temperature(settings.temperature())
        .timeout(timeout)
        .logRequests(false)
        .logResponses(false)
        .build();
  }
}
