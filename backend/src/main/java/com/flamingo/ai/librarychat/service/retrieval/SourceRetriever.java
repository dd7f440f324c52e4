package com.flamingo.ai.librarychat.service.retrieval;

import com.flamingo.ai.librarychat.elasticsearch.SourceIndexOperations;
import com.flamingo.ai.librarychat.exception.IndexNotFoundException;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Runs the vector search for a question.
 *
 * <p>A missing index is a stream failure. Any other failure is logged and resolves to no sources,
 * so the answer is still generated.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SourceRetriever {

  private final QueryEmbeddingService queryEmbeddingService;
  private final SourceIndexOperations sourceIndex;
  private final MeterRegistry meterRegistry;

  /**
   * Prepares retrieval. The search starts when the handle is first subscribed and runs on the
   * bounded-elastic scheduler.
   */
  public RetrievalHandle retrieve(String question, RetrievalFilter filter, int k) {
    Mono<List<SourceDocument>> documents =
        Mono.fromCallable(() -> search(question, filter, k))
            .subscribeOn(Schedulers.boundedElastic())
            .onErrorResume(
                e -> !(e instanceof IndexNotFoundException),
                e -> {
                  log.error(
                      "Retrieval failed for index {} with filter [{}]: {}",
                      sourceIndex.getIndexName(),
                      filter,
                      e.getMessage(),
                      e);
                  meterRegistry.counter("retrieval.failures").increment();
                  return Mono.just(List.of());
                });
    return new RetrievalHandle(documents);
  }

  private List<SourceDocument> search(String question, RetrievalFilter filter, int k) {
    sourceIndex.ensureIndexExists();
    List<Float> embedding = queryEmbeddingService.embed(question);
    List<SourceDocument> documents = sourceIndex.knnSearch(embedding, filter, k);
    log.debug("Retrieved {} sources (k={}) with filter [{}]", documents.size(), k, filter);
    return documents;
  }
}
