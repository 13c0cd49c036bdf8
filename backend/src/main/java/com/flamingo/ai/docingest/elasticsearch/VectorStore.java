package com.flamingo.ai.docingest.elasticsearch;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Collection-scoped vector store used by ingestion.
 *
 * <p>Writes are insert-if-absent: a record whose id already exists is never overwritten. Similarity
 * search is left to the retrieval side and is not part of this contract.
 */
public interface VectorStore {

  /** Name of the collection (index) the store writes to. */
  String getCollectionName();

  /**
   * Lightweight liveness check.
   *
   * @throws RuntimeException if the store cannot be reached
   */
  void verifyConnection();

  /** Creates the collection with cosine similarity if it does not exist yet. */
  void ensureCollection();

  /**
   * Returns the subset of {@code ids} already stored.
   *
   * @param ids chunk ids to look up
   * @return ids that exist
   */
  Set<String> existingIds(Collection<String> ids);

  /**
   * Inserts records whose ids are absent and leaves the others untouched.
   *
   * @param records records to insert
   * @return how many were inserted and how many already existed
   */
  UpsertResult upsert(List<VectorRecord> records);

  long count();

  /**
   * Deletes every record of an original document, including records of its segments.
   *
   * @param sourceDocumentId the original document id
   * @return number of records deleted
   */
  long deleteByDocument(String sourceDocumentId);

  /**
   * Deletes the records of one unit only. Records of segments cut from it are kept.
   *
   * @param unitId document or segment id, matched exactly against {@code documentId}
   * @return number of records deleted
   */
  long deleteByUnit(String unitId);
}
