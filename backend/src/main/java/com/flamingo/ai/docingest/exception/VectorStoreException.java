package com.flamingo.ai.docingest.exception;

/** Exception thrown when a vector store request fails or is only partly applied. */
public class VectorStoreException extends RuntimeException {

  private final String collection;

  public VectorStoreException(String collection, String message) {
    super(message);
    this.collection = collection;
  }

  public VectorStoreException(String collection, String message, Throwable cause) {
    super(message, cause);
    this.collection = collection;
  }

  public String getCollection() {
    return collection;
  }
}
