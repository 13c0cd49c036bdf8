package com.flamingo.ai.docingest.service.splitting;

import com.flamingo.ai.docingest.config.IngestionConfig;
import com.flamingo.ai.docingest.domain.model.IngestOutcome;
import com.flamingo.ai.docingest.domain.model.IngestionUnit;
import com.flamingo.ai.docingest.elasticsearch.ResilientVectorStore;
import com.flamingo.ai.docingest.exception.BackendUnavailableException;
import com.flamingo.ai.docingest.service.checkpoint.CheckpointStore;
import com.flamingo.ai.docingest.service.chunking.BoundarySplitter;
import com.flamingo.ai.docingest.service.chunking.TextMeasure;
import com.flamingo.ai.docingest.service.ingest.IngestionWorker;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Ingests a unit that is too large or keeps failing by halving it on semantic boundaries and
 * recursing into the halves.
 *
 * <p>A unit within {@code max-initial-bytes} is first tried as-is. Otherwise, or if that attempt
 * fails, it is cut into segments of about half its size (never below {@code min-segment-bytes}),
 * and each segment recurses one level deeper. At {@code max-depth} a segment gets one attempt
 * as-is and a failure there is final. A unit that yields a single segment has no boundary left to
 * exploit and is likewise a leaf: it gets one attempt in total. Recursion therefore always
 * terminates.
 *
 * <p>A unit succeeds only when all of its segments succeed. Successful segments are checkpointed
 * one by one, so a retried parent skips the parts that already landed; failed leaves are recorded
 * as skipped. Checkpointing the original document itself is left to the caller.
 *
 * <p>Before a unit is cut into segments its own chunks are deleted from the store. A failed as-is
 * attempt may have stored part of the unit, and the segments store that text again under their own
 * ids.
 *
 * <p>{@link BackendUnavailableException} is not remediated by splitting and propagates.
 */
@Service
@Slf4j
public class RecursiveSplitter {

  private final IngestionWorker worker;
  private final CheckpointStore checkpointStore;
  private final ResilientVectorStore vectorStore;
  private final MeterRegistry meterRegistry;
  private final long maxInitialBytes;
  private final long minSegmentBytes;
  private final int maxDepth;

  public RecursiveSplitter(
      IngestionWorker worker,
      CheckpointStore checkpointStore,
      ResilientVectorStore vectorStore,
      MeterRegistry meterRegistry,
      IngestionConfig config) {
    IngestionConfig.Splitter settings = config.getSplitter();
    if (settings.getMaxDepth() < 0) {
      throw new IllegalArgumentException(
          "ingestion.splitter.max-depth must be >= 0: " + settings.getMaxDepth());
    }
    if (settings.getMinSegmentBytes() <= 0 || settings.getMaxInitialBytes() <= 0) {
      throw new IllegalArgumentException("ingestion.splitter byte sizes must be > 0");
    }
    this.worker = worker;
    this.checkpointStore = checkpointStore;
    this.vectorStore = vectorStore;
    this.meterRegistry = meterRegistry;
    this.maxInitialBytes = settings.getMaxInitialBytes();
    this.minSegmentBytes = settings.getMinSegmentBytes();
    this.maxDepth = settings.getMaxDepth();
  }

  /** Recursively ingests {@code unit} starting from its own recursion level. */
  public SplitResult split(IngestionUnit unit) {
    return splitRecursive(unit, unit.recursionLevel());
  }

  /**
   * Recursively ingests {@code unit}.
   *
   * @param unit document or segment
   * @param level recursion level of {@code unit}
   * @return success, or the failed leaf segments
   */
  public SplitResult splitRecursive(IngestionUnit unit, int level) {
    if (unit.isSegment() && checkpointStore.isProcessed(unit.id())) {
      log.info("{}[level {}] {} already ingested, skipping", indent(level), level, unit.id());
      return SplitResult.succeeded(unit.id(), 0);
    }

    long bytes = unit.byteSize();
    log.info("{}[level {}] Processing {} ({} bytes)", indent(level), level, unit.id(), bytes);

    if (level >= maxDepth) {
      log.info(
          "{}[level {}] Max depth reached, attempting {} as-is", indent(level), level, unit.id());
      return attemptAsLeaf(unit, level);
    }
    boolean attempted = false;
    if (bytes <= maxInitialBytes) {
      if (attempt(unit, level).isSuccess()) {
        markSegment(unit, true);
        return SplitResult.succeeded(unit.id(), 0);
      }
      attempted = true;
      log.info("{}[level {}] Ingestion of {} failed, will split", indent(level), level, unit.id());
    }

    long target = Math.max((bytes + 1) / 2, minSegmentBytes);
    List<BoundarySplitter.Window> windows =
        BoundarySplitter.split(unit.text(), TextMeasure.UTF8_BYTES, target, 0);
    if (windows.size() <= 1) {
      log.warn("{}[level {}] {} cannot be split further", indent(level), level, unit.id());
      return attempted ? failedLeaf(unit) : attemptAsLeaf(unit, level);
    }

    log.info(
        "{}[level {}] Split {} into {} segments (target {} bytes)",
        indent(level),
        level,
        unit.id(),
        windows.size(),
        target);
    meterRegistry.counter("ingestion.segments.created").increment(windows.size());
    discardOwnChunks(unit, level);

    int segmentsCreated = windows.size();
    List<String> failedLeaves = new ArrayList<>();
    for (int i = 0; i < windows.size(); i++) {
      IngestionUnit segment = unit.segment(i + 1, windows.get(i).text(unit.text()));
      SplitResult child = splitRecursive(segment, level + 1);
      segmentsCreated += child.segmentsCreated();
      failedLeaves.addAll(child.failedLeaves());
    }

    if (failedLeaves.isEmpty()) {
      log.info("{}[level {}] All segments of {} succeeded", indent(level), level, unit.id());
      markSegment(unit, true);
      return SplitResult.succeeded(unit.id(), segmentsCreated);
    }
    log.error(
        "{}[level {}] {} failed: {} segment(s) could not be ingested: {}",
        indent(level),
        level,
        unit.id(),
        failedLeaves.size(),
        failedLeaves);
    return SplitResult.failed(unit.id(), failedLeaves, segmentsCreated);
  }

  private SplitResult attemptAsLeaf(IngestionUnit unit, int level) {
    if (attempt(unit, level).isSuccess()) {
      markSegment(unit, true);
      return SplitResult.succeeded(unit.id(), 0);
    }
    return failedLeaf(unit);
  }

  private SplitResult failedLeaf(IngestionUnit unit) {
    markSegment(unit, false);
    return SplitResult.failed(unit.id(), List.of(unit.id()), 0);
  }

  private IngestOutcome attempt(IngestionUnit unit, int level) {
    IngestOutcome outcome = worker.ingest(unit);
    if (!outcome.isSuccess()) {
      log.warn(
          "{}[level {}] {} -> {}: {}",
          indent(level),
          level,
          unit.id(),
          outcome.status(),
          outcome.message());
    }
    return outcome;
  }

  private void discardOwnChunks(IngestionUnit unit, int level) {
    long deleted = vectorStore.deleteByUnit(unit.id());
    if (deleted > 0) {
      log.info(
          "{}[level {}] Removed {} chunk(s) stored by the unsplit attempt of {}",
          indent(level),
          level,
          deleted,
          unit.id());
    }
  }

  private void markSegment(IngestionUnit unit, boolean success) {
    if (unit.isSegment()) {
      checkpointStore.mark(unit.id(), success);
    }
  }

  private static String indent(int level) {
    return "  ".repeat(level);
  }
}
