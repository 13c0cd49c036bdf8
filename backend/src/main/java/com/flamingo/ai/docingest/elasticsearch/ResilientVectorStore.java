package com.flamingo.ai.docingest.elasticsearch;

import com.flamingo.ai.docingest.exception.BackendUnavailableException;
import com.flamingo.ai.docingest.service.retry.BackoffRetryExecutor;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * The vector store as the pipeline sees it: every call goes through {@link BackoffRetryExecutor},
 * with a ping as the liveness check before each retry.
 *
 * <p>The collection is created on first use. Every method throws {@link
 * BackendUnavailableException} once retries are exhausted.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ResilientVectorStore {

  private final VectorStore vectorStore;
  private final BackoffRetryExecutor retryExecutor;

  private volatile boolean collectionReady;

  /** Connects and creates the collection if needed. Idempotent. */
  public void connect() {
    if (collectionReady) {
      return;
    }
    retryExecutor.execute(
        "connect",
        () -> {
          vectorStore.verifyConnection();
          return null;
        });
    retryExecutor.execute(
        "ensure-collection",
        () -> {
          vectorStore.ensureCollection();
          return null;
        },
        vectorStore::verifyConnection);
    collectionReady = true;
    log.info("Vector store ready, collection '{}'", vectorStore.getCollectionName());
  }

  public Set<String> existingIds(Collection<String> ids) {
    connect();
    return retryExecutor.execute(
        "get", () -> vectorStore.existingIds(ids), vectorStore::verifyConnection);
  }

  public UpsertResult upsert(List<VectorRecord> records) {
    connect();
    return retryExecutor.execute(
        "insert", () -> vectorStore.upsert(records), vectorStore::verifyConnection);
  }

  public long count() {
    connect();
    return retryExecutor.execute("count", vectorStore::count, vectorStore::verifyConnection);
  }

  public long deleteByDocument(String sourceDocumentId) {
    connect();
    return retryExecutor.execute(
        "delete-document",
        () -> vectorStore.deleteByDocument(sourceDocumentId),
        vectorStore::verifyConnection);
  }

  public long deleteByUnit(String unitId) {
    connect();
    return retryExecutor.execute(
        "delete-unit", () -> vectorStore.deleteByUnit(unitId), vectorStore::verifyConnection);
  }
}
