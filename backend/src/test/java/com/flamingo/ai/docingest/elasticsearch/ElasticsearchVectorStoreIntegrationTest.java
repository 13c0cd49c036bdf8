package com.flamingo.ai.docingest.elasticsearch;

import static org.assertj.core.api.Assertions.assertThat;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.rest5_client.Rest5ClientTransport;
import co.elastic.clients.transport.rest5_client.low_level.Rest5Client;
import com.flamingo.ai.docingest.domain.model.ChunkMetadata;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.util.List;
import org.apache.hc.core5.http.HttpHost;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.testcontainers.elasticsearch.ElasticsearchContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/** Runs {@link ElasticsearchVectorStore} against a real single-node Elasticsearch. */
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("ElasticsearchVectorStore Integration Tests")
class ElasticsearchVectorStoreIntegrationTest {

  @Container
  static final ElasticsearchContainer ELASTICSEARCH =
      new ElasticsearchContainer("docker.elastic.co/elasticsearch/elasticsearch:9.0.0")
          .withEnv("xpack.security.enabled", "false")
          .withEnv("ES_JAVA_OPTS", "-Xms512m -Xmx512m");

  private static Rest5Client restClient;
  private static ElasticsearchClient client;

  private ElasticsearchVectorStore store;

  @BeforeAll
  static void connect() {
    restClient =
        Rest5Client.builder(
                new HttpHost("http", ELASTICSEARCH.getHost(), ELASTICSEARCH.getMappedPort(9200)))
            .build();
    client =
        new ElasticsearchClient(new Rest5ClientTransport(restClient, new JacksonJsonpMapper()));
  }

  @AfterAll
  static void close() throws IOException {
    restClient.close();
  }

  @BeforeEach
  void setUp() throws IOException {
    if (client.indices().exists(e -> e.index("it-chunks")).value()) {
      client.indices().delete(d -> d.index("it-chunks"));
    }
    store = new ElasticsearchVectorStore(client, new SimpleMeterRegistry(), "it-chunks", 3);
    store.verifyConnection();
    store.ensureCollection();
  }

  private static VectorRecord record(String unitId, String sourceId, int index, String content) {
    return new VectorRecord(
        unitId + "_" + index,
        List.of(0.1f * (index + 1), 0.2f, 0.3f),
        content,
        new ChunkMetadata(
            unitId, sourceId, "chunk_" + (index + 1), index, 2, unitId.equals(sourceId) ? 0 : 1,
            "hash" + index, 5));
  }

  @Test
  @DisplayName("should insert new records and leave existing ones untouched")
  void shouldInsertIfAbsent() {
    UpsertResult first = store.upsert(List.of(record("doc", "doc", 0, "original")));
    UpsertResult second =
        store.upsert(List.of(record("doc", "doc", 0, "replacement"), record("doc", "doc", 1, "b")));

    assertThat(first.inserted()).isEqualTo(1);
    assertThat(second.inserted()).isEqualTo(1);
    assertThat(second.alreadyPresent()).isEqualTo(1);
    assertThat(store.count()).isEqualTo(2);
    assertThat(store.existingIds(List.of("doc_0", "doc_1", "doc_2")))
        .containsExactlyInAnyOrder("doc_0", "doc_1");
  }

  @Test
  @DisplayName("should delete every record of a document including its segments")
  void shouldDeleteByDocument() {
    store.upsert(
        List.of(
            record("doc", "doc", 0, "a"),
            record("doc#01", "doc", 0, "b"),
            record("other", "other", 0, "c")));

    long deleted = store.deleteByDocument("doc");

    assertThat(deleted).isEqualTo(2);
    assertThat(store.count()).isEqualTo(1);
    assertThat(store.existingIds(List.of("other_0"))).containsExactly("other_0");
  }

  @Test
  @DisplayName("should delete the records of one unit and keep its segments")
  void shouldDeleteByUnit() {
    store.upsert(
        List.of(
            record("doc", "doc", 0, "a"),
            record("doc", "doc", 1, "b"),
            record("doc#01", "doc", 0, "c")));

    long deleted = store.deleteByUnit("doc");

    assertThat(deleted).isEqualTo(2);
    assertThat(store.existingIds(List.of("doc_0", "doc_1", "doc#01_0")))
        .containsExactly("doc#01_0");
  }

  @Test
  @DisplayName("should create the index only once")
  void shouldEnsureCollectionIdempotently() {
    store.ensureCollection();

    assertThat(store.getCollectionName()).isEqualTo("it-chunks");
    assertThat(store.count()).isZero();
  }
}
