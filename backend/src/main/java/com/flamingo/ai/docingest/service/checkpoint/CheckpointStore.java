package com.flamingo.ai.docingest.service.checkpoint;

import java.util.Set;

/**
 * Ledger of unit ids known to be fully ingested, kept apart from the work queue so that a reset or
 * regenerated queue never re-ingests finished documents.
 *
 * <p>An id is in at most one of the two sets: {@code processed} or {@code skipped}. Ordinary
 * ingestion only ever adds to {@code processed}; {@link #clear} is reserved for explicit removal
 * and re-ingestion.
 */
public interface CheckpointStore {

  boolean isProcessed(String unitId);

  boolean isSkipped(String unitId);

  /**
   * Records the outcome for a unit, moving it between the two sets.
   *
   * @param unitId document or segment id
   * @param success {@code true} for processed, {@code false} for skipped
   */
  void mark(String unitId, boolean success);

  /**
   * Forgets a document and every segment cut from it.
   *
   * @param documentId the original document id
   * @return number of ids removed
   */
  int clear(String documentId);

  Set<String> processed();

  Set<String> skipped();
}
