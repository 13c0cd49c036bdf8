package com.flamingo.ai.docingest.service.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.docingest.config.IngestionConfig;
import com.flamingo.ai.docingest.domain.enums.IngestStatus;
import com.flamingo.ai.docingest.domain.model.IngestOutcome;
import com.flamingo.ai.docingest.domain.model.IngestionUnit;
import com.flamingo.ai.docingest.exception.BackendUnavailableException;
import com.flamingo.ai.docingest.service.checkpoint.FileCheckpointStore;
import com.flamingo.ai.docingest.service.ingest.IngestionWorker;
import com.flamingo.ai.docingest.service.queue.FileWorkQueue;
import com.flamingo.ai.docingest.service.splitting.RecursiveSplitter;
import com.flamingo.ai.docingest.service.splitting.SplitResult;
import com.flamingo.ai.docingest.support.TestConfigs;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("QueueIngestionService Tests")
class QueueIngestionServiceTest {

  @TempDir Path tempDir;

  @Mock private IngestionWorker worker;
  @Mock private RecursiveSplitter splitter;

  private IngestionConfig config;
  private Path documents;
  private FileWorkQueue workQueue;
  private FileCheckpointStore checkpointStore;

  @BeforeEach
  void setUp() throws IOException {
    config = TestConfigs.ingestionConfig();
    config.getQueue().setMaxAttempts(2);
    config.getSplitter().setEnabled(false);
    documents = Files.createDirectories(tempDir.resolve("docs"));
    ObjectMapper objectMapper = new ObjectMapper();
    workQueue = new FileWorkQueue(tempDir.resolve("queue.json"), objectMapper);
    checkpointStore = new FileCheckpointStore(tempDir.resolve("checkpoint.json"), objectMapper);
  }

  private QueueIngestionService service() {
    return new QueueIngestionService(
        workQueue,
        checkpointStore,
        new DocumentSource(documents, "**/*.txt"),
        worker,
        splitter,
        config);
  }

  private void writeDocument(String id, String text) throws IOException {
    Files.writeString(documents.resolve(id), text, StandardCharsets.UTF_8);
    workQueue.enqueue(id);
  }

  private static IngestOutcome success(IngestionUnit unit) {
    return IngestOutcome.success(unit.id(), 1, 1, 0);
  }

  @Test
  @DisplayName("should complete and checkpoint every queued document")
  void shouldDrainQueue() throws IOException {
    writeDocument("a.txt", "Alpha.");
    writeDocument("b.txt", "Beta.");
    when(worker.ingest(any())).thenAnswer(inv -> success(inv.getArgument(0)));

    RunSummary summary = service().processAll(0);

    assertThat(summary.steps()).isEqualTo(2);
    assertThat(summary.completed()).isEqualTo(2);
    assertThat(summary.queue().completed()).containsExactly("a.txt", "b.txt");
    assertThat(summary.queue().isDrained()).isTrue();
    assertThat(checkpointStore.processed()).containsExactlyInAnyOrder("a.txt", "b.txt");
    assertThat(service().processNext()).isEqualTo(StepOutcome.NO_WORK);
  }

  @Test
  @DisplayName("should requeue a failure and mark it failed once attempts are spent")
  void shouldFailAfterMaxAttempts() throws IOException {
    writeDocument("bad.txt", "Broken.");
    when(worker.ingest(any()))
        .thenAnswer(
            inv ->
                IngestOutcome.failed(
                    ((IngestionUnit) inv.getArgument(0)).id(), 2, 1, 0, 1, "chunk failed"));

    RunSummary summary = service().processAll(0);

    assertThat(summary.requeued()).isEqualTo(1);
    assertThat(summary.failed()).isEqualTo(1);
    assertThat(summary.queue().failed()).containsExactly("bad.txt");
    assertThat(checkpointStore.isSkipped("bad.txt")).isTrue();
    assertThat(checkpointStore.isProcessed("bad.txt")).isFalse();
  }

  @Test
  @DisplayName("should requeue when the backend is unavailable")
  void shouldRequeueOnBackendUnavailable() throws IOException {
    writeDocument("a.txt", "Alpha.");
    when(worker.ingest(any()))
        .thenThrow(new BackendUnavailableException("connect", 3, new IOException("refused")));

    assertThat(service().processNext()).isEqualTo(StepOutcome.REQUEUED);
    assertThat(workQueue.snapshot().pending()).containsExactly("a.txt");
    assertThat(checkpointStore.skipped()).isEmpty();
  }

  @Test
  @DisplayName("should complete an already checkpointed document without ingesting it")
  void shouldShortCircuitProcessedDocument() throws IOException {
    writeDocument("a.txt", "Alpha.");
    checkpointStore.mark("a.txt", true);

    assertThat(service().processNext()).isEqualTo(StepOutcome.COMPLETED);
    verify(worker, never()).ingest(any());
    assertThat(workQueue.snapshot().completed()).containsExactly("a.txt");
  }

  @Test
  @DisplayName("should requeue a document whose file has disappeared")
  void shouldRequeueMissingFile() {
    workQueue.enqueue("gone.txt");

    assertThat(service().processNext()).isEqualTo(StepOutcome.REQUEUED);
    verify(worker, never()).ingest(any());
  }

  @Test
  @DisplayName("should recover an entry left in processing by an earlier run")
  void shouldRecoverInFlightEntryOnStart() throws IOException {
    writeDocument("a.txt", "Alpha.");
    workQueue.dequeue();
    when(worker.ingest(any())).thenAnswer(inv -> success(inv.getArgument(0)));

    RunSummary summary = service().processAll(0);

    assertThat(summary.completed()).isEqualTo(1);
    assertThat(summary.queue().processing()).isEmpty();
  }

  @Test
  @DisplayName("should stop after the iteration budget")
  void shouldHonorMaxIterations() throws IOException {
    writeDocument("a.txt", "Alpha.");
    writeDocument("b.txt", "Beta.");
    when(worker.ingest(any())).thenAnswer(inv -> success(inv.getArgument(0)));

    RunSummary summary = service().processAll(1);

    assertThat(summary.steps()).isEqualTo(1);
    assertThat(summary.queue().pending()).containsExactly("b.txt");
  }

  @Test
  @DisplayName("should route through the splitter when it is enabled")
  void shouldUseSplitterWhenEnabled() throws IOException {
    config.getSplitter().setEnabled(true);
    writeDocument("big.txt", "Large.");
    when(splitter.split(any()))
        .thenReturn(SplitResult.failed("big.txt", List.of("big.txt#02"), 2));

    DocumentSource source = new DocumentSource(documents, "**/*.txt");

    DocumentResult result = service().ingestDocument(source.resolve("big.txt"), true);

    assertThat(result.status()).isEqualTo(IngestStatus.FAILED);
    assertThat(result.failedLeaves()).containsExactly("big.txt#02");
    assertThat(checkpointStore.isProcessed("big.txt")).isFalse();
    verify(worker, never()).ingest(any());
  }
}
