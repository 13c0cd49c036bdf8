package com.flamingo.ai.docingest.service.pipeline;

import com.flamingo.ai.docingest.domain.model.Document;
import com.flamingo.ai.docingest.domain.model.IngestionUnit;
import com.flamingo.ai.docingest.service.checkpoint.CheckpointStore;
import com.flamingo.ai.docingest.service.queue.WorkQueue;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Places documents that are not checkpointed as processed into the work queue.
 *
 * <p>An incremental scan first returns in-flight entries to pending, then enqueues new files. A
 * fresh scan rebuilds the queue from the checkpoint: processed ids become completed, skipped ids
 * become failed, and everything else on disk becomes pending.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DocumentScanner {

  private final DocumentSource documentSource;
  private final WorkQueue workQueue;
  private final CheckpointStore checkpointStore;

  /**
   * Result of a scan.
   *
   * @param discovered matching files on disk
   * @param alreadyProcessed of those, files the checkpoint has as processed
   * @param enqueued files newly placed in pending
   * @param recovered in-flight entries returned to pending
   */
  public record ScanResult(int discovered, int alreadyProcessed, int enqueued, int recovered) {}

  public ScanResult scan(boolean fresh) {
    List<Document> documents = documentSource.scan();
    Set<String> processed = checkpointStore.processed();

    List<String> unprocessed = new ArrayList<>();
    for (Document document : documents) {
      if (!processed.contains(document.id())) {
        unprocessed.add(document.id());
      }
    }
    int alreadyProcessed = documents.size() - unprocessed.size();

    if (fresh) {
      Set<String> skipped = checkpointStore.skipped();
      List<String> failed = new ArrayList<>();
      for (String id : unprocessed) {
        if (skipped.contains(id)) {
          failed.add(id);
        }
      }
      workQueue.regenerate(unprocessed, documentIdsOnly(processed), failed);
      int enqueued = unprocessed.size() - failed.size();
      log.info(
          "Fresh scan of {}: {} files, {} processed, {} pending, {} failed",
          documentSource,
          documents.size(),
          alreadyProcessed,
          enqueued,
          failed.size());
      return new ScanResult(documents.size(), alreadyProcessed, enqueued, 0);
    }

    int recovered = workQueue.recoverInFlight().size();
    int enqueued = 0;
    for (String id : unprocessed) {
      if (workQueue.enqueue(id)) {
        enqueued++;
      }
    }
    log.info(
        "Scan of {}: {} files, {} processed, {} newly queued, {} recovered",
        documentSource,
        documents.size(),
        alreadyProcessed,
        enqueued,
        recovered);
    return new ScanResult(documents.size(), alreadyProcessed, enqueued, recovered);
  }

  /** Segment ids live in the checkpoint too; the queue only tracks documents. */
  private static List<String> documentIdsOnly(Set<String> ids) {
    List<String> documents = new ArrayList<>();
    for (String id : ids) {
      if (!IngestionUnit.isSegmentId(id)) {
        documents.add(id);
      }
    }
    documents.sort(null);
    return documents;
  }
}
