package com.flamingo.ai.docingest.service.pipeline;

import com.flamingo.ai.docingest.config.IngestionConfig;
import com.flamingo.ai.docingest.domain.enums.IngestStatus;
import com.flamingo.ai.docingest.domain.model.Document;
import com.flamingo.ai.docingest.domain.model.IngestOutcome;
import com.flamingo.ai.docingest.domain.model.IngestionUnit;
import com.flamingo.ai.docingest.exception.BackendUnavailableException;
import com.flamingo.ai.docingest.exception.DocumentIngestionException;
import com.flamingo.ai.docingest.service.checkpoint.CheckpointStore;
import com.flamingo.ai.docingest.service.ingest.IngestionWorker;
import com.flamingo.ai.docingest.service.queue.QueueEntry;
import com.flamingo.ai.docingest.service.queue.QueueSnapshot;
import com.flamingo.ai.docingest.service.queue.WorkQueue;
import com.flamingo.ai.docingest.service.splitting.RecursiveSplitter;
import com.flamingo.ai.docingest.service.splitting.SplitResult;
import io.micrometer.core.annotation.Timed;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Drives documents from the work queue through the worker, one at a time, and records each outcome
 * in the queue and the checkpoint store.
 *
 * <p>A failed attempt goes back to pending until the entry has been dequeued {@code
 * ingestion.queue.max-attempts} times; after that it is marked failed in the queue and skipped in
 * the checkpoint.
 */
@Service
@Slf4j
public class QueueIngestionService {

  private final WorkQueue workQueue;
  private final CheckpointStore checkpointStore;
  private final DocumentSource documentSource;
  private final IngestionWorker worker;
  private final RecursiveSplitter splitter;
  private final int maxAttempts;
  private final boolean recoverOnStart;
  private final boolean splitterEnabled;

  public QueueIngestionService(
      WorkQueue workQueue,
      CheckpointStore checkpointStore,
      DocumentSource documentSource,
      IngestionWorker worker,
      RecursiveSplitter splitter,
      IngestionConfig config) {
    if (config.getQueue().getMaxAttempts() < 1) {
      throw new IllegalArgumentException(
          "ingestion.queue.max-attempts must be >= 1: " + config.getQueue().getMaxAttempts());
    }
    this.workQueue = workQueue;
    this.checkpointStore = checkpointStore;
    this.documentSource = documentSource;
    this.worker = worker;
    this.splitter = splitter;
    this.maxAttempts = config.getQueue().getMaxAttempts();
    this.recoverOnStart = config.getQueue().isRecoverOnStart();
    this.splitterEnabled = config.getSplitter().isEnabled();
  }

  /**
   * Ingests one document, short-circuiting if the checkpoint already has it.
   *
   * @param document the document
   * @param useSplitter route through the recursive splitter instead of a single worker attempt
   * @return the document-level result
   */
  @Timed(value = "ingestion.document", description = "Time to ingest one document")
  public DocumentResult ingestDocument(Document document, boolean useSplitter) {
    if (checkpointStore.isProcessed(document.id())) {
      log.info("{} already ingested, skipping", document.id());
      return DocumentResult.alreadyProcessed(document.id());
    }

    IngestionUnit unit = documentSource.load(document);
    DocumentResult result;
    if (useSplitter) {
      SplitResult split = splitter.split(unit);
      result =
          split.success()
              ? new DocumentResult(document.id(), IngestStatus.SUCCESS, false, List.of(), null)
              : new DocumentResult(
                  document.id(),
                  IngestStatus.FAILED,
                  false,
                  split.failedLeaves(),
                  split.failedLeaves().size() + " segment(s) failed");
    } else {
      IngestOutcome outcome = worker.ingest(unit);
      result =
          new DocumentResult(
              document.id(), outcome.status(), false, List.of(), outcome.message());
    }

    if (result.isSuccess()) {
      checkpointStore.mark(document.id(), true);
    }
    return result;
  }

  /**
   * Dequeues and processes one entry.
   *
   * @return what happened, {@link StepOutcome#NO_WORK} when the queue is empty
   */
  public StepOutcome processNext() {
    Optional<QueueEntry> next = workQueue.dequeue();
    if (next.isEmpty()) {
      return StepOutcome.NO_WORK;
    }
    QueueEntry entry = next.get();
    String id = entry.documentId();
    log.info("Processing {} (attempt {}/{})", id, entry.attempts(), maxAttempts);

    DocumentResult result;
    try {
      result = ingestDocument(documentSource.resolve(id), splitterEnabled);
    } catch (BackendUnavailableException | DocumentIngestionException e) {
      log.error("Ingestion of {} failed: {}", id, e.getMessage());
      result = DocumentResult.failed(id, e.getMessage());
    }

    if (result.isSuccess()) {
      workQueue.complete(id);
      return StepOutcome.COMPLETED;
    }
    if (entry.attempts() < maxAttempts) {
      log.warn(
          "{} failed ({}), requeued after attempt {}/{}",
          id,
          result.status(),
          entry.attempts(),
          maxAttempts);
      workQueue.requeue(id);
      return StepOutcome.REQUEUED;
    }
    log.error(
        "{} failed after {} attempt(s), marking failed: {} {}",
        id,
        entry.attempts(),
        result.message(),
        result.failedLeaves());
    workQueue.fail(id);
    checkpointStore.mark(id, false);
    return StepOutcome.FAILED;
  }

  /**
   * Processes entries until the queue has no pending work or {@code maxIterations} entries were
   * taken.
   *
   * @param maxIterations step budget, {@code <= 0} for no limit
   * @return run totals
   */
  @Timed(value = "ingestion.run", description = "Time to drain the queue")
  public RunSummary processAll(int maxIterations) {
    if (recoverOnStart) {
      workQueue.recoverInFlight();
    }
    int steps = 0;
    int completed = 0;
    int requeued = 0;
    int failed = 0;
    while (maxIterations <= 0 || steps < maxIterations) {
      StepOutcome outcome = processNext();
      if (outcome == StepOutcome.NO_WORK) {
        break;
      }
      steps++;
      switch (outcome) {
        case COMPLETED -> completed++;
        case REQUEUED -> requeued++;
        case FAILED -> failed++;
        default -> {}
      }
    }
    QueueSnapshot snapshot = workQueue.snapshot();
    log.info(
        "Run finished: {} step(s), {} completed, {} requeued, {} failed; queue now {} pending, {}"
            + " completed, {} failed",
        steps,
        completed,
        requeued,
        failed,
        snapshot.pending().size(),
        snapshot.completed().size(),
        snapshot.failed().size());
    return new RunSummary(steps, completed, requeued, failed, snapshot);
  }
}
