package com.flamingo.ai.docingest.service.pipeline;

import com.flamingo.ai.docingest.domain.enums.IngestStatus;
import java.util.List;

/**
 * Outcome of ingesting one source document end to end.
 *
 * @param documentId the document
 * @param status document-level verdict
 * @param alreadyProcessed {@code true} when the checkpoint short-circuited the run
 * @param failedLeaves segments that could not be stored, when the document was split
 * @param message failure description, {@code null} on success
 */
public record DocumentResult(
    String documentId,
    IngestStatus status,
    boolean alreadyProcessed,
    List<String> failedLeaves,
    String message) {

  public DocumentResult {
    failedLeaves = failedLeaves == null ? List.of() : List.copyOf(failedLeaves);
  }

  public static DocumentResult alreadyProcessed(String documentId) {
    return new DocumentResult(documentId, IngestStatus.SUCCESS, true, List.of(), null);
  }

  public static DocumentResult failed(String documentId, String message) {
    return new DocumentResult(documentId, IngestStatus.FAILED, false, List.of(), message);
  }

  public boolean isSuccess() {
    return status == IngestStatus.SUCCESS;
  }
}
