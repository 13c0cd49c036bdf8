package com.flamingo.ai.docingest.service.embedding;

import com.flamingo.ai.docingest.exception.BackendUnavailableException;
import com.flamingo.ai.docingest.service.retry.BackoffRetryExecutor;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Service;

/**
 * Service for generating passage embeddings with the configured {@link EmbeddingModel}.
 *
 * <p>Text is never truncated here: the ingestion worker has already sized every chunk, and cutting
 * text would silently drop content from the index.
 */
@Service
@Slf4j
public class EmbeddingService {

  private final EmbeddingModel embeddingModel;
  private final BackoffRetryExecutor retryExecutor;
  private final MeterRegistry meterRegistry;

  public EmbeddingService(
      @Lazy EmbeddingModel embeddingModel,
      BackoffRetryExecutor retryExecutor,
      MeterRegistry meterRegistry) {
    this.embeddingModel = embeddingModel;
    this.retryExecutor = retryExecutor;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Embeds one passage, retrying transient provider failures.
   *
   * @param passage the passage text
   * @return embedding vector
   */
  @Timed(value = "embedding.embedPassage", description = "Time to embed passage")
  public List<Float> embedPassage(String passage) {
    log.debug("embedPassage called, input length: {} chars", passage.length());
    List<Float> vector;
    try {
      vector =
          retryExecutor.execute(
              "embed",
              () -> {
                Response<Embedding> response = embeddingModel.embed(passage);
                return toFloatList(response.content().vector());
              });
    } catch (BackendUnavailableException e) {
      meterRegistry.counter("embedding.requests.failure").increment();
      throw e;
    }
    if (vector.isEmpty()) {
      meterRegistry.counter("embedding.requests.failure").increment();
      throw new IllegalStateException("Embedding model returned an empty vector");
    }
    meterRegistry.counter("embedding.requests.success").increment();
    return vector;
  }

  /** Converts float array to Float list. */
  private List<Float> toFloatList(float[] vector) {
    List<Float> result = new ArrayList<>(vector.length);
    for (float f : vector) {
      result.add(f);
    }
    return result;
  }
}
