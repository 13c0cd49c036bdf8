package com.flamingo.ai.docingest.domain.model;

import com.flamingo.ai.docingest.domain.enums.IngestStatus;

/**
 * Result of {@code IngestionWorker.ingest}. Carries partial credit: a failed unit may still have
 * inserted some of its chunks.
 *
 * @param unitId the ingested unit
 * @param status document-level verdict
 * @param totalChunks chunks the unit produced
 * @param inserted chunks newly written to the store
 * @param skipped chunks already present and left untouched
 * @param failed chunks that could not be embedded or stored
 * @param message failure description, {@code null} on success
 */
public record IngestOutcome(
    String unitId,
    IngestStatus status,
    int totalChunks,
    int inserted,
    int skipped,
    int failed,
    String message) {

  public static IngestOutcome success(String unitId, int totalChunks, int inserted, int skipped) {
    return new IngestOutcome(unitId, IngestStatus.SUCCESS, totalChunks, inserted, skipped, 0, null);
  }

  public static IngestOutcome sizeExceeded(String unitId, String message) {
    return new IngestOutcome(unitId, IngestStatus.SIZE_EXCEEDED, 0, 0, 0, 0, message);
  }

  public static IngestOutcome failed(
      String unitId, int totalChunks, int inserted, int skipped, int failed, String message) {
    return new IngestOutcome(
        unitId, IngestStatus.FAILED, totalChunks, inserted, skipped, failed, message);
  }

  public boolean isSuccess() {
    return status == IngestStatus.SUCCESS;
  }
}
