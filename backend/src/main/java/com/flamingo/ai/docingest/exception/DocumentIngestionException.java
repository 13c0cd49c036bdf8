package com.flamingo.ai.docingest.exception;

/** Exception thrown when a document cannot be ingested. */
public class DocumentIngestionException extends RuntimeException {

  private final String documentId;
  private final String userMessage;

  public DocumentIngestionException(String documentId, String message) {
    super(message);
    this.documentId = documentId;
    this.userMessage = "Failed to ingest document";
  }

  public DocumentIngestionException(String documentId, String message, Throwable cause) {
    super(message, cause);
    this.documentId = documentId;
    this.userMessage = "Failed to ingest document";
  }

  public DocumentIngestionException(String documentId, String message, String userMessage) {
    super(message);
    this.documentId = documentId;
    this.userMessage = userMessage;
  }

  public String getDocumentId() {
    return documentId;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
