package com.flamingo.ai.docingest.config;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

/** Configuration for the LangChain4j embedding model and its tokenizer. */
@Configuration
public class LangChain4jConfig {

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.embedding-model.model-name:text-embedding-3-small}")
  private String embeddingModelName;

  @Value("${langchain4j.openai.embedding-model.dimensions:1536}")
  private int embeddingDimensions;

  @Value("${langchain4j.openai.embedding-model.timeout-seconds:30}")
  private int timeoutSeconds;

  /**
   * The OpenAI embedding model. Created lazily so that commands which never embed (status, scan)
   * run without an API key.
   *
   * <p>Client-side retries are disabled: every call goes through the backoff executor instead.
   */
  @Bean
  @Lazy
  public EmbeddingModel embeddingModel() {
    validateApiKey();

    return OpenAiEmbeddingModel.builder()
        .apiKey(openAiApiKey)
        .modelName(embeddingModelName)
        .dimensions(embeddingDimensions)
        .timeout(Duration.ofSeconds(timeoutSeconds))
        .maxRetries(0)
        .build();
  }

  /**
   * BPE encoding used to size chunks. The same encoding family the OpenAI embedding models use.
   *
   * @param ingestionConfig supplies the encoding name
   * @return the encoding
   */
  @Bean
  public Encoding tokenEncoding(IngestionConfig ingestionConfig) {
    String name = ingestionConfig.getChunking().getEncoding();
    return Encodings.newDefaultEncodingRegistry()
        .getEncoding(name)
        .orElseThrow(() -> new IllegalStateException("Unknown token encoding: " + name));
  }

  private void validateApiKey() {
    if (openAiApiKey == null || openAiApiKey.isBlank()) {
      throw new IllegalStateException(
          "OpenAI API key is required. Set langchain4j.openai.api-key (OPENAI_API_KEY).");
    }
  }
}
