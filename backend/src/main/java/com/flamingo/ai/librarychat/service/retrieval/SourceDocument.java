package com.flamingo.ai.librarychat.service.retrieval;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A retrieved passage and its index metadata (source, library, author, type and so on).
 *
 * <p>Serialized as-is into {@code sourceDocs} events and into stored answers.
 */
public record SourceDocument(String pageContent, Map<String, Object> metadata) {

  public SourceDocument {
    pageContent = pageContent == null ? "" : pageContent;
    metadata =
        metadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }
}
