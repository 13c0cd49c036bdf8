package com.flamingo.ai.docingest.elasticsearch;

import com.flamingo.ai.docingest.domain.model.ChunkMetadata;
import java.util.List;

/**
 * One chunk as written to the vector store.
 *
 * @param id chunk id, {@code unitId_index}
 * @param embedding the passage vector
 * @param content the passage text
 * @param metadata citation metadata stored next to the vector
 */
public record VectorRecord(
    String id, List<Float> embedding, String content, ChunkMetadata metadata) {

  public VectorRecord {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Vector record id must not be blank");
    }
    if (embedding == null || embedding.isEmpty()) {
      throw new IllegalArgumentException("Vector record " + id + " has no embedding");
    }
    embedding = List.copyOf(embedding);
  }
}
