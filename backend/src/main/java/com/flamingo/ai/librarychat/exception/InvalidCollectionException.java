package com.flamingo.ai.librarychat.exception;

/** Thrown when the request names a collection that is not configured. */
public class InvalidCollectionException extends RuntimeException {

  private final String collection;

  public InvalidCollectionException(String collection) {
    super("Unknown collection: " + collection);
    this.collection = collection;
  }

  public String getCollection() {
    return collection;
  }

  public String getUserMessage() {
    return "Invalid collection provided";
  }
}
