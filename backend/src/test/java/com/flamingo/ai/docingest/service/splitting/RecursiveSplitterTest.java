package com.flamingo.ai.docingest.service.splitting;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTimeout;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.docingest.config.IngestionConfig;
import com.flamingo.ai.docingest.domain.model.IngestOutcome;
import com.flamingo.ai.docingest.domain.model.IngestionUnit;
import com.flamingo.ai.docingest.elasticsearch.InMemoryVectorStore;
import com.flamingo.ai.docingest.elasticsearch.ResilientVectorStore;
import com.flamingo.ai.docingest.elasticsearch.VectorRecord;
import com.flamingo.ai.docingest.exception.BackendUnavailableException;
import com.flamingo.ai.docingest.service.checkpoint.FileCheckpointStore;
import com.flamingo.ai.docingest.service.chunking.SemanticChunker;
import com.flamingo.ai.docingest.service.embedding.EmbeddingService;
import com.flamingo.ai.docingest.service.ingest.IngestionWorker;
import com.flamingo.ai.docingest.service.retry.BackoffRetryExecutor;
import com.flamingo.ai.docingest.support.StubEmbeddingModel;
import com.flamingo.ai.docingest.support.TestConfigs;
import com.flamingo.ai.docingest.support.TestTexts;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("RecursiveSplitter Tests")
class RecursiveSplitterTest {

  @TempDir Path tempDir;

  @Mock private IngestionWorker worker;

  private IngestionConfig config;
  private FileCheckpointStore checkpointStore;
  private SimpleMeterRegistry meterRegistry;
  private InMemoryVectorStore store;

  /** Four paragraphs of near-equal size, which halve into exactly two segments. */
  private final IngestionUnit document =
      IngestionUnit.ofDocument("doc", TestTexts.paragraphs(4, 3));

  @BeforeEach
  void setUp() {
    config = TestConfigs.ingestionConfig();
    config.getSplitter().setMaxDepth(1);
    config.getSplitter().setMinSegmentBytes(1);
    checkpointStore =
        new FileCheckpointStore(tempDir.resolve("checkpoint.json"), new ObjectMapper());
    meterRegistry = new SimpleMeterRegistry();
    store = new InMemoryVectorStore();
  }

  private RecursiveSplitter splitter() {
    return splitter(worker);
  }

  private RecursiveSplitter splitter(IngestionWorker ingestionWorker) {
    ResilientVectorStore vectorStore =
        new ResilientVectorStore(store, new BackoffRetryExecutor(config, meterRegistry));
    return new RecursiveSplitter(
        ingestionWorker, checkpointStore, vectorStore, meterRegistry, config);
  }

  private IngestionWorker realWorker(StubEmbeddingModel model) {
    BackoffRetryExecutor retryExecutor = new BackoffRetryExecutor(config, meterRegistry);
    return new IngestionWorker(
        new SemanticChunker(TestTexts.tokenizer()),
        new EmbeddingService(model, retryExecutor, meterRegistry),
        new ResilientVectorStore(store, retryExecutor),
        meterRegistry,
        config);
  }

  private static int levelOf(String unitId) {
    return unitId.split("#", -1).length - 1;
  }

  private void workerFailsFor(Predicate<IngestionUnit> failing) {
    doAnswer(
            invocation -> {
              IngestionUnit unit = invocation.getArgument(0);
              return failing.test(unit)
                  ? IngestOutcome.sizeExceeded(unit.id(), "too large")
                  : IngestOutcome.success(unit.id(), 1, 1, 0);
            })
        .when(worker)
        .ingest(any());
  }

  @Test
  @DisplayName("should not split a unit that ingests as-is")
  void shouldIngestSmallUnitDirectly() {
    workerFailsFor(unit -> false);

    SplitResult result = splitter().split(document);

    assertThat(result.success()).isTrue();
    assertThat(result.segmentsCreated()).isZero();
    verify(worker, times(1)).ingest(any());
    assertThat(checkpointStore.processed()).isEmpty();
  }

  @Test
  @DisplayName("should split an oversized document into two level-1 segments")
  void shouldSplitOversizedDocument() {
    workerFailsFor(unit -> !unit.isSegment());

    SplitResult result = splitter().split(document);

    assertThat(result.success()).isTrue();
    assertThat(result.segmentsCreated()).isEqualTo(2);
    assertThat(checkpointStore.processed()).containsExactlyInAnyOrder("doc#01", "doc#02");
    verify(worker)
        .ingest(argThat(unit -> unit.id().equals("doc#01") && unit.recursionLevel() == 1));
    assertThat(meterRegistry.counter("ingestion.segments.created").count()).isEqualTo(2.0);
  }

  @Test
  @DisplayName("should report the failing leaf and skip finished segments on retry")
  void shouldReportFailedLeafAndResume() {
    workerFailsFor(unit -> !unit.isSegment() || unit.id().equals("doc#02"));

    SplitResult failed = splitter().split(document);

    assertThat(failed.success()).isFalse();
    assertThat(failed.failedLeaves()).containsExactly("doc#02");
    assertThat(checkpointStore.isProcessed("doc#01")).isTrue();
    assertThat(checkpointStore.isSkipped("doc#02")).isTrue();

    workerFailsFor(unit -> !unit.isSegment());
    SplitResult retried = splitter().split(document);

    assertThat(retried.success()).isTrue();
    assertThat(checkpointStore.processed()).contains("doc#01", "doc#02");
    assertThat(checkpointStore.skipped()).isEmpty();
    verify(worker, times(1)).ingest(argThat(unit -> unit.id().equals("doc#01")));
  }

  @Test
  @DisplayName("should attempt a unit with no usable boundary once, as a leaf")
  void shouldTreatUnsplittableUnitAsLeaf() {
    config.getSplitter().setMaxInitialBytes(10);
    workerFailsFor(unit -> true);
    IngestionUnit runOn = IngestionUnit.ofDocument("runon", "x".repeat(1000));

    SplitResult result = splitter().split(runOn);

    assertThat(result.success()).isFalse();
    assertThat(result.failedLeaves()).containsExactly("runon");
    verify(worker, times(1)).ingest(any());
    assertThat(checkpointStore.skipped()).isEmpty();
  }

  @Test
  @DisplayName("should let an unavailable backend propagate instead of splitting")
  void shouldPropagateBackendUnavailable() {
    when(worker.ingest(any()))
        .thenThrow(new BackendUnavailableException("connect", 3, new IOException("refused")));

    assertThatThrownBy(() -> splitter().split(document))
        .isInstanceOf(BackendUnavailableException.class);
    verify(worker, never()).ingest(argThat(IngestionUnit::isSegment));
  }

  @Test
  @DisplayName("should store each passage once when a partly stored unit is split")
  void shouldDiscardPartialChunksBeforeSplitting() {
    config.getSplitter().setMaxDepth(2);
    config.getChunking().setMaxTokens(200);
    config.getChunking().setOverlapTokens(0);
    IngestionUnit unit = IngestionUnit.ofDocument("doc", TestTexts.paragraphs(20, 3));
    // the chunk holding sentence 40 fails until its retries are used up, then recovers
    String flaky = TestTexts.sentence(40);
    AtomicInteger flakyCalls = new AtomicInteger();
    StubEmbeddingModel model =
        new StubEmbeddingModel(text -> text.contains(flaky) && flakyCalls.getAndIncrement() < 3);

    SplitResult result = splitter(realWorker(model)).split(unit);

    assertThat(result.success()).isTrue();
    assertThat(result.segmentsCreated()).isPositive();
    assertThat(store.records().values())
        .extracting(r -> r.metadata().documentId())
        .doesNotContain("doc")
        .allMatch(IngestionUnit::isSegmentId);
    for (int n = 0; n < 60; n++) {
      String sentence = TestTexts.sentence(n);
      assertThat(store.records().values())
          .as("copies of sentence %d", n)
          .filteredOn((VectorRecord r) -> r.content().contains(sentence))
          .hasSize(1);
    }
  }

  @Test
  @DisplayName("should stop at max depth and report every unsplit segment as a failed leaf")
  void shouldTerminateAtMaxDepth() {
    config.getSplitter().setMaxDepth(3);
    List<IngestionUnit> attempted = new ArrayList<>();
    doAnswer(
            invocation -> {
              IngestionUnit unit = invocation.getArgument(0);
              attempted.add(unit);
              return IngestOutcome.sizeExceeded(unit.id(), "too large");
            })
        .when(worker)
        .ingest(any());
    IngestionUnit unit = IngestionUnit.ofDocument("doc", TestTexts.paragraphs(8, 4));

    SplitResult result = assertTimeout(Duration.ofSeconds(30), () -> splitter().split(unit));

    assertThat(result.success()).isFalse();
    assertThat(attempted).extracting(IngestionUnit::id).doesNotHaveDuplicates();
    assertThat(attempted).allMatch(u -> u.recursionLevel() <= 3);
    assertThat(attempted).anyMatch(u -> u.recursionLevel() == 3 && levelOf(u.id()) == 3);
    assertThat(result.segmentsCreated()).isEqualTo(attempted.size() - 1);

    // a leaf is an attempted unit that was never cut further
    List<String> expectedLeaves = new ArrayList<>();
    for (IngestionUnit candidate : attempted) {
      boolean hasChildren =
          attempted.stream().anyMatch(u -> candidate.id().equals(u.parentId()));
      if (!hasChildren) {
        expectedLeaves.add(candidate.id());
      }
    }
    assertThat(result.failedLeaves()).containsExactlyElementsOf(expectedLeaves);
    assertThat(result.failedLeaves()).allMatch(id -> levelOf(id) <= 3 && levelOf(id) >= 1);
    assertThat(checkpointStore.skipped()).containsExactlyInAnyOrderElementsOf(expectedLeaves);
    assertThat(checkpointStore.processed()).isEmpty();
  }
}
