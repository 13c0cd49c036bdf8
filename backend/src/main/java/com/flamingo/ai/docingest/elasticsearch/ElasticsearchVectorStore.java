package com.flamingo.ai.docingest.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.Refresh;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TextProperty;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.DeleteByQueryResponse;
import co.elastic.clients.elasticsearch.core.MgetResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkResponseItem;
import co.elastic.clients.elasticsearch.core.mget.MultiGetResponseItem;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import com.flamingo.ai.docingest.config.IngestionConfig;
import com.flamingo.ai.docingest.exception.VectorStoreException;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * {@link VectorStore} backed by an Elasticsearch index with a cosine {@code dense_vector} field.
 *
 * <p>Inserts use bulk {@code create} operations, which Elasticsearch rejects with 409 when the id
 * exists. That rejection is how insert-if-absent is enforced on the server side, so a record is
 * never overwritten even when the existence pre-check was skipped or raced.
 */
@Service
@Slf4j
public class ElasticsearchVectorStore implements VectorStore {

  private static final int HTTP_CONFLICT = 409;

  private final ElasticsearchClient elasticsearchClient;
  private final MeterRegistry meterRegistry;
  private final String indexName;
  private final int vectorDimensions;

  @Autowired
  public ElasticsearchVectorStore(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      IngestionConfig config) {
    this(
        elasticsearchClient,
        meterRegistry,
        config.getStore().getIndexName(),
        config.getStore().getVectorDimensions());
  }

  /** Constructor for testing - allows setting index name and vector dimensions. */
  @VisibleForTesting
  public ElasticsearchVectorStore(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      String indexName,
      int vectorDimensions) {
    if (vectorDimensions <= 0) {
      throw new IllegalArgumentException("Vector dimensions must be > 0: " + vectorDimensions);
    }
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
    this.indexName = indexName;
    this.vectorDimensions = vectorDimensions;
  }

  @Override
  public String getCollectionName() {
    return indexName;
  }

  @Override
  public void verifyConnection() {
    try {
      if (!elasticsearchClient.ping().value()) {
        throw new VectorStoreException(indexName, "Elasticsearch did not answer ping");
      }
    } catch (IOException e) {
      throw new VectorStoreException(indexName, "Elasticsearch is unreachable", e);
    }
  }

  @Override
  public void ensureCollection() {
    try {
      boolean exists = elasticsearchClient.indices().exists(e -> e.index(indexName)).value();
      if (exists) {
        log.debug("Elasticsearch index '{}' already exists", indexName);
        return;
      }
      // dynamic=false keeps undeclared fields out of the mapping
      CreateIndexRequest request =
          CreateIndexRequest.of(
              c ->
                  c.index(indexName)
                      .mappings(
                          m ->
                              m.dynamic(DynamicMapping.False)
                                  .properties(defineIndexProperties())));
      elasticsearchClient.indices().create(request);
      log.info("Created Elasticsearch index: {} ({} dims, cosine)", indexName, vectorDimensions);
    } catch (IOException e) {
      throw new VectorStoreException(
          indexName, "Failed to initialize Elasticsearch index '" + indexName + "'", e);
    }
  }

  @VisibleForTesting
  Map<String, Property> defineIndexProperties() {
    Map<String, Property> properties = new HashMap<>();
    // identifiers MUST be keyword type for exact matching
    properties.put("documentId", Property.of(p -> p.keyword(k -> k)));
    properties.put("sourceDocumentId", Property.of(p -> p.keyword(k -> k)));
    properties.put("section", Property.of(p -> p.keyword(k -> k)));
    properties.put("contentHash", Property.of(p -> p.keyword(k -> k)));
    properties.put("chunkIndex", Property.of(p -> p.integer(i -> i)));
    properties.put("totalChunks", Property.of(p -> p.integer(i -> i)));
    properties.put("recursionLevel", Property.of(p -> p.integer(i -> i)));
    properties.put("tokenCount", Property.of(p -> p.integer(i -> i)));
    properties.put("content", Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put(
        "embedding",
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d ->
                            d.dims(vectorDimensions)
                                .index(true)
                                .similarity(DenseVectorSimilarity.Cosine)))));
    return properties;
  }

  @Override
  public Set<String> existingIds(Collection<String> ids) {
    if (ids.isEmpty()) {
      return Set.of();
    }
    try {
      MgetResponse<Map> response =
          elasticsearchClient.mget(
              m -> m.index(indexName).ids(new ArrayList<>(ids)).source(s -> s.fetch(false)),
              Map.class);
      Set<String> existing = new HashSet<>();
      for (MultiGetResponseItem<Map> item : response.docs()) {
        if (item.isResult() && item.result().found()) {
          existing.add(item.result().id());
        }
      }
      return existing;
    } catch (IOException e) {
      throw new VectorStoreException(indexName, "Failed to look up ids in " + indexName, e);
    }
  }

  @Override
  @Timed(value = "elasticsearch.upsert", description = "Time to insert chunk vectors")
  public UpsertResult upsert(List<VectorRecord> records) {
    if (records.isEmpty()) {
      return UpsertResult.empty();
    }
    try {
      BulkRequest.Builder bulkBuilder = new BulkRequest.Builder().refresh(Refresh.WaitFor);
      for (VectorRecord vectorRecord : records) {
        Map<String, Object> docMap = convertToDocument(vectorRecord);
        bulkBuilder.operations(
            op -> op.create(c -> c.index(indexName).id(vectorRecord.id()).document(docMap)));
      }

      BulkResponse response = elasticsearchClient.bulk(bulkBuilder.build());
      int inserted = 0;
      int alreadyPresent = 0;
      List<String> failures = new ArrayList<>();
      for (BulkResponseItem item : response.items()) {
        if (item.error() == null) {
          inserted++;
        } else if (item.status() == HTTP_CONFLICT) {
          alreadyPresent++;
        } else {
          failures.add(item.id() + ": " + item.error().reason());
        }
      }
      meterRegistry.counter("elasticsearch.indexed").increment(inserted);
      if (!failures.isEmpty()) {
        meterRegistry.counter("elasticsearch.index.errors").increment(failures.size());
        throw new VectorStoreException(
            indexName,
            failures.size() + " of " + records.size() + " records failed to insert: " + failures);
      }
      log.debug(
          "Inserted {} records into {} ({} already present)", inserted, indexName, alreadyPresent);
      return new UpsertResult(inserted, alreadyPresent);
    } catch (IOException e) {
      throw new VectorStoreException(indexName, "Failed to insert records into " + indexName, e);
    }
  }

  @Override
  public long count() {
    try {
      return elasticsearchClient.count(c -> c.index(indexName)).count();
    } catch (IOException e) {
      throw new VectorStoreException(indexName, "Failed to count records in " + indexName, e);
    }
  }

  @Override
  public long deleteByDocument(String sourceDocumentId) {
    long deleted = deleteWhere("sourceDocumentId", sourceDocumentId);
    log.info("Deleted {} records of document {} from {}", deleted, sourceDocumentId, indexName);
    return deleted;
  }

  @Override
  public long deleteByUnit(String unitId) {
    long deleted = deleteWhere("documentId", unitId);
    log.debug("Deleted {} records of unit {} from {}", deleted, unitId, indexName);
    return deleted;
  }

  private long deleteWhere(String field, String value) {
    try {
      DeleteByQueryResponse response =
          elasticsearchClient.deleteByQuery(
              d ->
                  d.index(indexName)
                      .query(q -> q.term(t -> t.field(field).value(value)))
                      .refresh(true));
      long deleted = response.deleted() == null ? 0 : response.deleted();
      meterRegistry.counter("elasticsearch.deleted").increment(deleted);
      return deleted;
    } catch (IOException e) {
      throw new VectorStoreException(
          indexName, "Failed to delete records of " + value + " from " + indexName, e);
    }
  }

  private Map<String, Object> convertToDocument(VectorRecord vectorRecord) {
    Map<String, Object> doc = new LinkedHashMap<>(vectorRecord.metadata().toMap());
    doc.put("content", vectorRecord.content());
    doc.put("embedding", vectorRecord.embedding());
    return doc;
  }
}
