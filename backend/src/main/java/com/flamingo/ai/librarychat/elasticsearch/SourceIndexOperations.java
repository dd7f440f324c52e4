package com.flamingo.ai.librarychat.elasticsearch;

import com.flamingo.ai.librarychat.service.retrieval.RetrievalFilter;
import com.flamingo.ai.librarychat.service.retrieval.SourceDocument;
import java.util.List;

/** Read-only operations on the source passage index. */
public interface SourceIndexOperations {

  /**
   * Verifies that the index exists.
   *
   * @throws com.flamingo.ai.librarychat.exception.IndexNotFoundException if it does not
   */
  void ensureIndexExists();

  /**
   * Performs a k-nearest-neighbour search restricted by {@code filter}.
   *
   * @param queryEmbedding the question's embedding
   * @param filter inclusion constraints, all of which must hold
   * @param topK number of passages to return
   * @return matching passages, most similar first
   */
  List<SourceDocument> knnSearch(List<Float> queryEmbedding, RetrievalFilter filter, int topK);

  String getIndexName();
}
