package com.flamingo.ai.librarychat.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import com.flamingo.ai.librarychat.config.ChatProperties;
import com.flamingo.ai.librarychat.exception.IndexNotFoundException;
import com.flamingo.ai.librarychat.service.retrieval.RetrievalFilter;
import com.flamingo.ai.librarychat.service.retrieval.SourceDocument;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Elasticsearch-backed source passage index.
 *
 * <p>Passages are stored with their text in {@code text}, their vector in {@code embedding} and
 * keyword metadata fields ({@code type}, {@code author}, {@code library}, ...) alongside. The index
 * is populated by a separate ingestion process; this service only reads it.
 */
@Service
@Slf4j
public class SourceChunkIndexService implements SourceIndexOperations {

  static final String TEXT_FIELD = "text";
  static final String EMBEDDING_FIELD = "embedding";

  private static final String INDEX_NOT_FOUND = "index_not_found_exception";

  // Elasticsearch rejects num_candidates above this, and k may not exceed num_candidates.
  static final int MAX_NUM_CANDIDATES = 10_000;

  private final ElasticsearchClient elasticsearchClient;
  private final MeterRegistry meterRegistry;
  private final String indexName;

  // Only a positive answer is cached; a missing index is re-checked on each request.
  private final AtomicBoolean indexVerified = new AtomicBoolean(false);

  public SourceChunkIndexService(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      ChatProperties chatProperties) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
    this.indexName = chatProperties.getRetrieval().getIndexName();
  }

  @Override
  public String getIndexName() {
    return indexName;
  }

  @Override
  public void ensureIndexExists() {
    if (indexVerified.get()) {
      return;
    }
    boolean exists;
    try {
      exists = elasticsearchClient.indices().exists(e -> e.index(indexName)).value();
    } catch (IOException e) {
      throw new IllegalStateException("Failed to check index " + indexName, e);
    }
    if (!exists) {
      throw new IndexNotFoundException(indexName);
    }
    indexVerified.set(true);
  }

  @Override
  @Timed(value = "elasticsearch.vector_search", description = "Time for vector search")
  public List<SourceDocument> knnSearch(
      List<Float> queryEmbedding, RetrievalFilter filter, int topK) {
    SearchRequest request = buildVectorSearchRequest(queryEmbedding, filter, topK);
    try {
      SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);
      logSearchResults(filter, response);
      meterRegistry.counter("source_chunk.vector_search").increment();
      return mapHitsToDocuments(response.hits().hits());
    } catch (ElasticsearchException e) {
      if (isIndexNotFound(e)) {
        indexVerified.set(false);
        throw new IndexNotFoundException(indexName, e);
      }
      throw e;
    } catch (IOException e) {
      log.error("Vector search failed for {}: {}", indexName, e.getMessage(), e);
      throw new IllegalStateException("Vector search failed", e);
    }
  }

  @VisibleForTesting
  SearchRequest buildVectorSearchRequest(
      List<Float> queryEmbedding, RetrievalFilter filter, int topK) {
    List<Query> filters = new ArrayList<>();
    for (RetrievalFilter.Constraint constraint : filter.constraints()) {
      filters.add(termsQuery(constraint));
    }
    int k = Math.max(1, Math.min(topK, MAX_NUM_CANDIDATES));
    int numCandidates = (int) Math.min(2L * k, MAX_NUM_CANDIDATES);
    if (k != topK) {
      log.warn("Requested {} sources, searching for {}", topK, k);
    }

    return SearchRequest.of(
        s ->
            s.index(indexName)
                .knn(
                    knn ->
                        knn.field(EMBEDDING_FIELD)
                            .queryVector(queryEmbedding)
                            .k(k)
                            .numCandidates(numCandidates)
                            .filter(filters))
                .source(src -> src.filter(f -> f.excludes(EMBEDDING_FIELD)))
                .size(k));
  }

  private static Query termsQuery(RetrievalFilter.Constraint constraint) {
    List<FieldValue> values = constraint.values().stream().map(FieldValue::of).toList();
    return Query.of(
        q -> q.terms(t -> t.field(constraint.field()).terms(tf -> tf.value(values))));
  }

  private static boolean isIndexNotFound(ElasticsearchException e) {
    return e.status() == 404
        || (e.error() != null && INDEX_NOT_FOUND.equals(e.error().type()));
  }

  @SuppressWarnings("unchecked")
  private List<SourceDocument> mapHitsToDocuments(List<Hit<Map>> hits) {
    List<SourceDocument> documents = new ArrayList<>();
    for (Hit<Map> hit : hits) {
      Map<String, Object> source = hit.source();
      if (source != null) {
        documents.add(toSourceDocument(source));
      }
    }
    return documents;
  }

  @VisibleForTesting
  static SourceDocument toSourceDocument(Map<String, Object> source) {
    Map<String, Object> metadata = new LinkedHashMap<>(source);
    Object text = metadata.remove(TEXT_FIELD);
    metadata.remove(EMBEDDING_FIELD);
    return new SourceDocument(text != null ? text.toString() : "", metadata);
  }

  @SuppressWarnings("unchecked")
  private void logSearchResults(RetrievalFilter filter, SearchResponse<Map> response) {
    List<Hit<Map>> hits = response.hits().hits();
    long totalHits =
        response.hits().total() != null ? response.hits().total().value() : hits.size();
    log.info(
        "[knnSearch] index={} filter=[{}] totalHits={} returned={}",
        indexName,
        filter,
        totalHits,
        hits.size());
    if (!log.isDebugEnabled()) {
      return;
    }
    for (int i = 0; i < hits.size(); i++) {
      Hit<Map> hit = hits.get(i);
      Map<String, Object> src = hit.source();
      String title = src != null && src.get("title") != null ? src.get("title").toString() : "";
      log.debug(
          "  [knnSearch] rank={} id={} score={} title='{}'", i + 1, hit.id(), hit.score(), title);
    }
  }
}
