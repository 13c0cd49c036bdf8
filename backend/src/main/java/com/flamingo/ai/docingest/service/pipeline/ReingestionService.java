package com.flamingo.ai.docingest.service.pipeline;

import com.flamingo.ai.docingest.elasticsearch.ResilientVectorStore;
import com.flamingo.ai.docingest.service.checkpoint.CheckpointStore;
import com.flamingo.ai.docingest.service.queue.WorkQueue;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Operator actions that undo ingestion. These are the only code paths that remove ids from the
 * checkpoint's processed set.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ReingestionService {

  private final ResilientVectorStore vectorStore;
  private final CheckpointStore checkpointStore;
  private final WorkQueue workQueue;

  /**
   * Result of removing a document.
   *
   * @param documentId the document
   * @param recordsDeleted vectors deleted from the store
   * @param checkpointsCleared checkpoint ids removed, segments included
   */
  public record RemovalResult(String documentId, long recordsDeleted, int checkpointsCleared) {}

  /** Deletes every stored chunk of a document and forgets it in the checkpoint. */
  public RemovalResult remove(String documentId) {
    long deleted = vectorStore.deleteByDocument(documentId);
    int cleared = checkpointStore.clear(documentId);
    log.info(
        "Removed {}: {} record(s) deleted, {} checkpoint id(s) cleared",
        documentId,
        deleted,
        cleared);
    return new RemovalResult(documentId, deleted, cleared);
  }

  /** Removes a document and puts it back to pending. */
  public RemovalResult reingest(String documentId) {
    RemovalResult removal = remove(documentId);
    workQueue.forceEnqueue(documentId);
    log.info("{} queued for re-ingestion", documentId);
    return removal;
  }

  /** Returns every failed queue entry to pending with a fresh attempt budget. */
  public List<String> retryFailed() {
    List<String> retried = workQueue.retryFailed();
    log.info("{} failed entr(ies) returned to pending: {}", retried.size(), retried);
    return retried;
  }
}
