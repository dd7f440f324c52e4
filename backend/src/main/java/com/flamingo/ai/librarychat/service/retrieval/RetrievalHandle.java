package com.flamingo.ai.librarychat.service.retrieval;

import java.util.List;
import reactor.core.publisher.Mono;

/**
 * One request's retrieval, resolved at most once.
 *
 * <p>{@link #documents()} may be subscribed any number of times; the search runs on the first
 * subscription and every subscriber sees the same result.
 */
public final class RetrievalHandle {

  private final Mono<List<SourceDocument>> documents;

  public RetrievalHandle(Mono<List<SourceDocument>> documents) {
    this.documents = documents.cache();
  }

  public static RetrievalHandle of(List<SourceDocument> documents) {
    return new RetrievalHandle(Mono.just(List.copyOf(documents)));
  }

  public Mono<List<SourceDocument>> documents() {
    return documents;
  }
}
