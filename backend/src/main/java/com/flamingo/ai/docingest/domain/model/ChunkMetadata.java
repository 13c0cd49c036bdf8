package com.flamingo.ai.docingest.domain.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Metadata stored next to every chunk vector, consumed by citation and retrieval.
 *
 * @param documentId id of the unit (document or segment) the chunk belongs to
 * @param sourceDocumentId id of the original document
 * @param section human readable section label, {@code chunk_N} (1-based)
 * @param chunkIndex 0-based chunk index within the unit
 * @param totalChunks number of chunks the unit produced
 * @param recursionLevel recursion level of the unit
 * @param contentHash SHA-256 of the chunk text
 * @param tokenCount tokens in the chunk
 */
public record ChunkMetadata(
    String documentId,
    String sourceDocumentId,
    String section,
    int chunkIndex,
    int totalChunks,
    int recursionLevel,
    String contentHash,
    int tokenCount) {

  public ChunkMetadata {
    if (documentId == null || documentId.isBlank()) {
      throw new IllegalArgumentException("documentId must not be blank");
    }
    if (sourceDocumentId == null || sourceDocumentId.isBlank()) {
      throw new IllegalArgumentException("sourceDocumentId must not be blank");
    }
    if (section == null || section.isBlank()) {
      throw new IllegalArgumentException("section must not be blank");
    }
    if (totalChunks < 1) {
      throw new IllegalArgumentException("totalChunks must be >= 1: " + totalChunks);
    }
    if (chunkIndex < 0 || chunkIndex >= totalChunks) {
      throw new IllegalArgumentException(
          "chunkIndex " + chunkIndex + " out of range for " + totalChunks + " chunks");
    }
    if (recursionLevel < 0) {
      throw new IllegalArgumentException("recursionLevel must be >= 0: " + recursionLevel);
    }
  }

  public static ChunkMetadata of(IngestionUnit unit, Chunk chunk, int totalChunks) {
    return new ChunkMetadata(
        unit.id(),
        unit.rootDocumentId(),
        "chunk_" + (chunk.index() + 1),
        chunk.index(),
        totalChunks,
        unit.recursionLevel(),
        chunk.contentHash(),
        chunk.tokenCount());
  }

  /** Field map in the layout of the vector store document. */
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("documentId", documentId);
    map.put("sourceDocumentId", sourceDocumentId);
    map.put("section", section);
    map.put("chunkIndex", chunkIndex);
    map.put("totalChunks", totalChunks);
    map.put("recursionLevel", recursionLevel);
    map.put("contentHash", contentHash);
    map.put("tokenCount", tokenCount);
    return map;
  }
}
