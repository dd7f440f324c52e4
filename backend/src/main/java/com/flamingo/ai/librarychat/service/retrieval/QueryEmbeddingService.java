package com.flamingo.ai.librarychat.service.retrieval;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Embeds questions into the vector space of the source index. */
@Service
@RequiredArgsConstructor
@Slf4j
public class QueryEmbeddingService {

  // Questions are capped at 4000 chars upstream; escaping can grow them a little.
  private static final int MAX_CHARS_PER_EMBEDDING = 5000;

  private final EmbeddingModel embeddingModel;

  @Timed(value = "embedding.query", description = "Time to embed a question")
  @Retry(name = "openai")
  public List<Float> embed(String question) {
    String text = question;
    if (text.length() > MAX_CHARS_PER_EMBEDDING) {
      log.warn(
          "Question too long for embedding, truncating from {} chars to {} chars",
          text.length(),
          MAX_CHARS_PER_EMBEDDING);
      text = text.substring(0, MAX_CHARS_PER_EMBEDDING);
    }
    Response<Embedding> response = embeddingModel.embed(text);
    float[] vector = response.content().vector();
    List<Float> result = new ArrayList<>(vector.length);
    for (float f : vector) {
      result.add(f);
    }
    return result;
  }
}
