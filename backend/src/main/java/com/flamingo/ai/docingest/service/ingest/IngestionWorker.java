package com.flamingo.ai.docingest.service.ingest;

import com.flamingo.ai.docingest.config.IngestionConfig;
import com.flamingo.ai.docingest.domain.model.Chunk;
import com.flamingo.ai.docingest.domain.model.ChunkMetadata;
import com.flamingo.ai.docingest.domain.model.IngestOutcome;
import com.flamingo.ai.docingest.domain.model.IngestionUnit;
import com.flamingo.ai.docingest.elasticsearch.ResilientVectorStore;
import com.flamingo.ai.docingest.elasticsearch.UpsertResult;
import com.flamingo.ai.docingest.elasticsearch.VectorRecord;
import com.flamingo.ai.docingest.exception.BackendUnavailableException;
import com.flamingo.ai.docingest.exception.SizeExceededException;
import com.flamingo.ai.docingest.service.chunking.DocumentChunker;
import com.flamingo.ai.docingest.service.embedding.EmbeddingService;
import com.google.common.collect.Lists;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Ingests one unit: chunk, skip chunks already stored, embed the rest and insert them in small
 * batches.
 *
 * <p>Chunk-level failures are logged and counted without aborting the unit; any such failure still
 * makes the unit-level outcome {@code FAILED}. A unit over the byte limit, a chunk over the
 * embedding model's token limit, or running out of memory is reported as {@code SIZE_EXCEEDED} so
 * that the caller can split it. Losing the vector store connection altogether propagates as {@link
 * BackendUnavailableException}.
 */
@Service
@Slf4j
public class IngestionWorker {

  private final DocumentChunker chunker;
  private final EmbeddingService embeddingService;
  private final ResilientVectorStore vectorStore;
  private final MeterRegistry meterRegistry;
  private final int maxTokens;
  private final int overlapTokens;
  private final int batchSize;
  private final long maxDocumentBytes;
  private final int maxEmbeddingTokens;
  private final boolean verifyAfterInsert;

  public IngestionWorker(
      DocumentChunker chunker,
      EmbeddingService embeddingService,
      ResilientVectorStore vectorStore,
      MeterRegistry meterRegistry,
      IngestionConfig config) {
    IngestionConfig.Chunking chunking = config.getChunking();
    IngestionConfig.Worker worker = config.getWorker();
    if (chunking.getMaxTokens() <= 0) {
      throw new IllegalArgumentException(
          "ingestion.chunking.max-tokens must be > 0: " + chunking.getMaxTokens());
    }
    if (chunking.getOverlapTokens() < 0
        || chunking.getOverlapTokens() >= chunking.getMaxTokens()) {
      throw new IllegalArgumentException(
          "ingestion.chunking.overlap-tokens must be >= 0 and < max-tokens: "
              + chunking.getOverlapTokens());
    }
    if (worker.getBatchSize() <= 0) {
      throw new IllegalArgumentException(
          "ingestion.worker.batch-size must be > 0: " + worker.getBatchSize());
    }
    if (worker.getMaxDocumentBytes() <= 0 || worker.getMaxEmbeddingTokens() <= 0) {
      throw new IllegalArgumentException("ingestion.worker size limits must be > 0");
    }
    this.chunker = chunker;
    this.embeddingService = embeddingService;
    this.vectorStore = vectorStore;
    this.meterRegistry = meterRegistry;
    this.maxTokens = chunking.getMaxTokens();
    this.overlapTokens = chunking.getOverlapTokens();
    this.batchSize = worker.getBatchSize();
    this.maxDocumentBytes = worker.getMaxDocumentBytes();
    this.maxEmbeddingTokens = worker.getMaxEmbeddingTokens();
    this.verifyAfterInsert = worker.isVerifyAfterInsert();
  }

  /**
   * Ingests one document or segment.
   *
   * @param unit the unit to ingest
   * @return the outcome, with partial credit on failure
   * @throws BackendUnavailableException if the vector store cannot be reached at all
   */
  @Timed(value = "ingestion.worker.ingest", description = "Time to ingest one unit")
  public IngestOutcome ingest(IngestionUnit unit) {
    IngestOutcome outcome;
    try {
      outcome = doIngest(unit);
    } catch (SizeExceededException e) {
      log.warn("{} is too large for a single attempt: {}", unit.id(), e.getMessage());
      outcome = IngestOutcome.sizeExceeded(unit.id(), e.getMessage());
    } catch (OutOfMemoryError e) {
      log.error("Ran out of memory ingesting {} ({} bytes)", unit.id(), unit.byteSize());
      outcome = IngestOutcome.sizeExceeded(unit.id(), "Out of memory: " + e.getMessage());
    }
    meterRegistry
        .counter("ingestion.documents", "outcome", outcome.status().name().toLowerCase(Locale.ROOT))
        .increment();
    return outcome;
  }

  private IngestOutcome doIngest(IngestionUnit unit) {
    long bytes = unit.byteSize();
    if (bytes > maxDocumentBytes) {
      throw new SizeExceededException(unit.id(), bytes, maxDocumentBytes, "bytes");
    }

    List<Chunk> chunks = chunker.chunk(unit.id(), unit.text(), maxTokens, overlapTokens);
    log.info(
        "Ingesting {} (level {}, {} bytes, {} chunks)",
        unit.id(),
        unit.recursionLevel(),
        bytes,
        chunks.size());
    if (chunks.isEmpty()) {
      log.info("{} has no text, nothing to store", unit.id());
      return IngestOutcome.success(unit.id(), 0, 0, 0);
    }
    for (Chunk chunk : chunks) {
      if (chunk.tokenCount() > maxEmbeddingTokens) {
        throw new SizeExceededException(
            chunk.id(), chunk.tokenCount(), maxEmbeddingTokens, "tokens");
      }
    }

    vectorStore.connect();

    int total = chunks.size();
    int inserted = 0;
    int skipped = 0;
    int failed = 0;
    String lastError = null;
    for (List<Chunk> batch : Lists.partition(chunks, batchSize)) {
      Set<String> existing = lookupExisting(unit, batch);

      List<VectorRecord> records = new ArrayList<>(batch.size());
      for (Chunk chunk : batch) {
        if (existing.contains(chunk.id())) {
          skipped++;
          continue;
        }
        try {
          List<Float> embedding = embeddingService.embedPassage(chunk.text());
          records.add(
              new VectorRecord(
                  chunk.id(), embedding, chunk.text(), ChunkMetadata.of(unit, chunk, total)));
        } catch (RuntimeException e) {
          failed++;
          lastError = e.getMessage();
          log.warn("{}: chunk {} could not be embedded: {}", unit.id(), chunk.id(), e.getMessage());
        }
      }
      if (records.isEmpty()) {
        continue;
      }

      try {
        UpsertResult result = vectorStore.upsert(records);
        inserted += result.inserted();
        skipped += result.alreadyPresent();
        int missing = verify(unit, records);
        if (missing > 0) {
          failed += missing;
          inserted = Math.max(0, inserted - missing);
          lastError = missing + " inserted chunk(s) not found on verification";
        }
      } catch (BackendUnavailableException e) {
        failed += records.size();
        lastError = e.getMessage();
        log.warn(
            "{}: batch of {} chunk(s) starting at {} could not be inserted: {}",
            unit.id(),
            records.size(),
            records.get(0).id(),
            e.getMessage());
      }
    }

    meterRegistry.counter("ingestion.chunks.inserted").increment(inserted);
    meterRegistry.counter("ingestion.chunks.skipped").increment(skipped);
    meterRegistry.counter("ingestion.chunks.failed").increment(failed);

    if (failed > 0) {
      log.error(
          "{}: {} of {} chunk(s) failed ({} inserted, {} already present)",
          unit.id(),
          failed,
          total,
          inserted,
          skipped);
      return IngestOutcome.failed(unit.id(), total, inserted, skipped, failed, lastError);
    }
    log.info(
        "{}: {} chunk(s) stored ({} inserted, {} already present)",
        unit.id(),
        total,
        inserted,
        skipped);
    return IngestOutcome.success(unit.id(), total, inserted, skipped);
  }

  /**
   * Ids in the batch that are already stored. When the lookup itself fails every chunk is treated
   * as new: inserts are create-only, so a stored chunk is still never overwritten.
   */
  private Set<String> lookupExisting(IngestionUnit unit, List<Chunk> batch) {
    List<String> ids = new ArrayList<>(batch.size());
    for (Chunk chunk : batch) {
      ids.add(chunk.id());
    }
    try {
      return vectorStore.existingIds(ids);
    } catch (BackendUnavailableException e) {
      log.warn("{}: duplicate check failed, inserting as new: {}", unit.id(), e.getMessage());
      return Set.of();
    }
  }

  private int verify(IngestionUnit unit, List<VectorRecord> records) {
    if (!verifyAfterInsert) {
      return 0;
    }
    Set<String> expected = new HashSet<>();
    for (VectorRecord vectorRecord : records) {
      expected.add(vectorRecord.id());
    }
    Set<String> stored = vectorStore.existingIds(expected);
    expected.removeAll(stored);
    if (!expected.isEmpty()) {
      log.warn("{}: {} chunk(s) missing after insert: {}", unit.id(), expected.size(), expected);
    }
    return expected.size();
  }
}
