package com.flamingo.ai.docingest.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the ingestion pipeline.
 *
 * <p>Bound once at start-up and handed to components through their constructors.
 */
@Configuration
@ConfigurationProperties(prefix = "ingestion")
@Getter
@Setter
public class IngestionConfig {

  private static final long MIB = 1024L * 1024L;

  private Source source = new Source();
  private Chunking chunking = new Chunking();
  private Worker worker = new Worker();
  private Queue queue = new Queue();
  private Splitter splitter = new Splitter();
  private Retry retry = new Retry();
  private State state = new State();
  private Store store = new Store();

  @Getter
  @Setter
  public static class Source {
    private String root = "data/documents";
    private String glob = "**/*.txt";
  }

  @Getter
  @Setter
  public static class Chunking {
    private int maxTokens = 1000;
    private int overlapTokens = 200;
    private String encoding = "cl100k_base";
  }

  @Getter
  @Setter
  public static class Worker {
    /** Chunks embedded and inserted together; bounds peak memory per document. */
    private int batchSize = 10;

    private long maxDocumentBytes = 10 * MIB;

    /** Hard input limit of the embedding model. */
    private int maxEmbeddingTokens = 8191;

    private boolean verifyAfterInsert = true;
  }

  @Getter
  @Setter
  public static class Queue {
    private int maxAttempts = 3;
    private boolean recoverOnStart = true;
  }

  @Getter
  @Setter
  public static class Splitter {
    private boolean enabled = true;
    private long maxInitialBytes = 10 * MIB;
    private long minSegmentBytes = 50 * 1024L;
    private int maxDepth = 5;
  }

  @Getter
  @Setter
  public static class Retry {
    private int maxAttempts = 5;
    private Duration baseDelay = Duration.ofSeconds(1);
  }

  @Getter
  @Setter
  public static class State {
    private String queueFile = "checkpoints/file_queue.json";
    private String checkpointFile = "checkpoints/ingest_checkpoint.json";
  }

  @Getter
  @Setter
  public static class Store {
    private String indexName = "document-chunks";
    private int vectorDimensions = 1536;
  }
}
