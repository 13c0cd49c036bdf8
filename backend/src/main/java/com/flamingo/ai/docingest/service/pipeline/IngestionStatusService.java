package com.flamingo.ai.docingest.service.pipeline;

import com.flamingo.ai.docingest.elasticsearch.ResilientVectorStore;
import com.flamingo.ai.docingest.exception.BackendUnavailableException;
import com.flamingo.ai.docingest.service.checkpoint.CheckpointStore;
import com.flamingo.ai.docingest.service.queue.QueueSnapshot;
import com.flamingo.ai.docingest.service.queue.WorkQueue;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Summarizes queue, checkpoint and store state for operators. */
@Service
@Slf4j
@RequiredArgsConstructor
public class IngestionStatusService {

  private final WorkQueue workQueue;
  private final CheckpointStore checkpointStore;
  private final ResilientVectorStore vectorStore;

  /** Overall state of the pipeline. */
  public enum Verdict {
    /** The queue has never been filled. */
    EMPTY,
    /** Some entry is being processed. */
    RUNNING,
    /** Pending work, nobody processing it. */
    PAUSED,
    /** Nothing pending or processing. */
    COMPLETE
  }

  /**
   * Point-in-time status.
   *
   * @param queue queue lists
   * @param processedCount ids checkpointed as processed, segments included
   * @param skippedCount ids checkpointed as skipped
   * @param storeCount records in the vector store, {@code -1} if it could not be counted
   * @param storeError why the store could not be counted, {@code null} otherwise
   * @param verdict overall state
   */
  public record StatusReport(
      QueueSnapshot queue,
      int processedCount,
      int skippedCount,
      long storeCount,
      String storeError,
      Verdict verdict) {

    public List<String> inFlight() {
      return queue.processing();
    }
  }

  public StatusReport report() {
    QueueSnapshot queue = workQueue.snapshot();
    long storeCount = -1;
    String storeError = null;
    try {
      storeCount = vectorStore.count();
    } catch (BackendUnavailableException e) {
      storeError = e.getMessage();
      log.warn("Vector store count unavailable: {}", e.getMessage());
    }
    return new StatusReport(
        queue,
        checkpointStore.processed().size(),
        checkpointStore.skipped().size(),
        storeCount,
        storeError,
        verdict(queue));
  }

  static Verdict verdict(QueueSnapshot queue) {
    if (queue.total() == 0) {
      return Verdict.EMPTY;
    }
    if (!queue.processing().isEmpty()) {
      return Verdict.RUNNING;
    }
    if (!queue.pending().isEmpty()) {
      return Verdict.PAUSED;
    }
    return Verdict.COMPLETE;
  }
}
