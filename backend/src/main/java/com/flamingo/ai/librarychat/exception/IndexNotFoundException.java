package com.flamingo.ai.librarychat.exception;

/** Thrown when the configured vector index does not exist. */
public class IndexNotFoundException extends RuntimeException {

  private final String indexName;

  public IndexNotFoundException(String indexName) {
    super("Vector index not found: " + indexName);
    this.indexName = indexName;
  }

  public IndexNotFoundException(String indexName, Throwable cause) {
    super("Vector index not found: " + indexName, cause);
    this.indexName = indexName;
  }

  public String getIndexName() {
    return indexName;
  }
}
