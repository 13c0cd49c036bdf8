package com.flamingo.ai.docingest.cli;

import com.flamingo.ai.docingest.domain.model.Document;
import com.flamingo.ai.docingest.exception.BackendUnavailableException;
import com.flamingo.ai.docingest.exception.DocumentIngestionException;
import com.flamingo.ai.docingest.exception.StateStoreException;
import com.flamingo.ai.docingest.service.pipeline.DocumentResult;
import com.flamingo.ai.docingest.service.pipeline.DocumentScanner;
import com.flamingo.ai.docingest.service.pipeline.DocumentSource;
import com.flamingo.ai.docingest.service.pipeline.IngestionStatusService;
import com.flamingo.ai.docingest.service.pipeline.QueueIngestionService;
import com.flamingo.ai.docingest.service.pipeline.ReingestionService;
import com.flamingo.ai.docingest.service.pipeline.RunSummary;
import java.nio.file.Path;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Command-line front end.
 *
 * <pre>
 *   ingest &lt;path&gt; [--split]      ingest one file (exit 3 when it is too large)
 *   scan [--fresh]                 queue unprocessed files
 *   process [--max-iterations=N]   drain the queue
 *   status                         queue, checkpoint and store summary
 *   remove &lt;docId&gt;                delete a document's chunks and checkpoints
 *   reingest &lt;docId&gt;              remove, then queue again
 *   retry-failed                   return failed entries to pending
 * </pre>
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class IngestionCommandRunner implements ApplicationRunner, ExitCodeGenerator {

  private static final String USAGE =
      "usage: ingest <path> [--split] | scan [--fresh] | process [--max-iterations=N] | status"
          + " | remove <docId> | reingest <docId> | retry-failed";

  private final QueueIngestionService queueIngestionService;
  private final DocumentScanner documentScanner;
  private final DocumentSource documentSource;
  private final IngestionStatusService statusService;
  private final ReingestionService reingestionService;

  private WorkerExitCode exitCode = WorkerExitCode.SUCCESS;

  @Override
  public void run(ApplicationArguments args) {
    exitCode = execute(args);
  }

  @Override
  public int getExitCode() {
    return exitCode.getCode();
  }

  WorkerExitCode execute(ApplicationArguments args) {
    List<String> positional = args.getNonOptionArgs();
    if (positional.isEmpty()) {
      log.info(USAGE);
      return WorkerExitCode.USAGE;
    }
    String command = positional.get(0);
    try {
      switch (command) {
        case "ingest":
          if (positional.size() != 2) {
            return usage("ingest needs exactly one path");
          }
          return ingest(Path.of(positional.get(1)), args.containsOption("split"));
        case "scan":
          DocumentScanner.ScanResult scan = documentScanner.scan(args.containsOption("fresh"));
          log.info(
              "Scan: {} discovered, {} already processed, {} queued, {} recovered",
              scan.discovered(),
              scan.alreadyProcessed(),
              scan.enqueued(),
              scan.recovered());
          return WorkerExitCode.SUCCESS;
        case "process":
          Integer maxIterations = intOption(args, "max-iterations");
          if (maxIterations == null) {
            return usage("--max-iterations must be an integer");
          }
          RunSummary summary = queueIngestionService.processAll(maxIterations);
          return summary.failed() > 0 ? WorkerExitCode.FAILURE : WorkerExitCode.SUCCESS;
        case "status":
          printStatus(statusService.report());
          return WorkerExitCode.SUCCESS;
        case "remove":
          if (positional.size() != 2) {
            return usage("remove needs exactly one document id");
          }
          reingestionService.remove(positional.get(1));
          return WorkerExitCode.SUCCESS;
        case "reingest":
          if (positional.size() != 2) {
            return usage("reingest needs exactly one document id");
          }
          reingestionService.reingest(positional.get(1));
          return WorkerExitCode.SUCCESS;
        case "retry-failed":
          reingestionService.retryFailed();
          return WorkerExitCode.SUCCESS;
        default:
          return usage("unknown command '" + command + "'");
      }
    } catch (BackendUnavailableException e) {
      log.error("{}: {}", e.getUserMessage(), e.getMessage());
      return WorkerExitCode.FAILURE;
    } catch (DocumentIngestionException e) {
      log.error("{}: {}", e.getUserMessage(), e.getMessage());
      return WorkerExitCode.FAILURE;
    } catch (StateStoreException e) {
      log.error("{}: {}", e.getUserMessage(), e.getMessage(), e);
      return WorkerExitCode.FAILURE;
    }
  }

  private WorkerExitCode ingest(Path path, boolean split) {
    Document document = documentSource.fromPath(path);
    DocumentResult result = queueIngestionService.ingestDocument(document, split);
    switch (result.status()) {
      case SUCCESS:
        log.info(
            "{} {}",
            document.id(),
            result.alreadyProcessed() ? "was already ingested" : "ingested successfully");
        return WorkerExitCode.SUCCESS;
      case SIZE_EXCEEDED:
        log.warn("{} is too large, retry with --split: {}", document.id(), result.message());
        return WorkerExitCode.SIZE_EXCEEDED;
      default:
        log.error(
            "{} failed: {} {}", document.id(), result.message(), result.failedLeaves());
        return WorkerExitCode.FAILURE;
    }
  }

  private void printStatus(IngestionStatusService.StatusReport report) {
    log.info("Status: {}", report.verdict());
    log.info(
        "Queue: {} pending, {} processing, {} completed, {} failed",
        report.queue().pending().size(),
        report.queue().processing().size(),
        report.queue().completed().size(),
        report.queue().failed().size());
    log.info(
        "Checkpoint: {} processed, {} skipped", report.processedCount(), report.skippedCount());
    if (report.storeError() == null) {
      log.info("Vector store: {} records", report.storeCount());
    } else {
      log.warn("Vector store: unavailable ({})", report.storeError());
    }
    if (!report.inFlight().isEmpty()) {
      log.info("In flight: {}", report.inFlight());
    }
    if (!report.queue().failed().isEmpty()) {
      log.info("Failed: {}", report.queue().failed());
    }
  }

  /** Integer option value, 0 when absent, {@code null} when malformed. */
  private static Integer intOption(ApplicationArguments args, String name) {
    List<String> values = args.getOptionValues(name);
    if (values == null || values.isEmpty()) {
      return 0;
    }
    try {
      return Integer.parseInt(values.get(values.size() - 1));
    } catch (NumberFormatException e) {
      log.warn("Invalid --{} value {}: {}", name, values, e.getMessage());
      return null;
    }
  }

  private static WorkerExitCode usage(String problem) {
    log.error("{}\n{}", problem, USAGE);
    return WorkerExitCode.USAGE;
  }
}
