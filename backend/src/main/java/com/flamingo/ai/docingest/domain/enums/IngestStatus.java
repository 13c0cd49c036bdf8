package com.flamingo.ai.docingest.domain.enums;

/** Document-level result of one ingestion attempt. */
public enum IngestStatus {
  /** All chunks are present in the vector store. */
  SUCCESS,

  /** The unit is too large for one attempt and should be split. */
  SIZE_EXCEEDED,

  /** At least one chunk could not be stored. */
  FAILED
}
