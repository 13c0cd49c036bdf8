package com.flamingo.ai.docingest.exception;

/**
 * Thrown when a unit of work is too large for a single ingestion attempt.
 *
 * <p>Never retried by the backoff executor. The recursive splitter is the only remediation.
 */
public class SizeExceededException extends DocumentIngestionException {

  private final long size;
  private final long limit;

  public SizeExceededException(String documentId, long size, long limit, String unit) {
    super(
        documentId,
        String.format(
            "Unit %s is too large: %d %s exceeds limit %d", documentId, size, unit, limit),
        "Document is too large to ingest in one piece");
    this.size = size;
    this.limit = limit;
  }

  public long getSize() {
    return size;
  }

  public long getLimit() {
    return limit;
  }
}
