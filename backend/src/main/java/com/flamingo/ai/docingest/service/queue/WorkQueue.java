package com.flamingo.ai.docingest.service.queue;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Durable record of documents moving through {@code pending -> processing -> completed | failed}.
 *
 * <p>Every transition is persisted before the call returns. An entry left in {@code processing}
 * by a worker that died is not lost: {@link #recoverInFlight()} treats it as pending again.
 */
public interface WorkQueue {

  /**
   * Adds a document as pending.
   *
   * @param documentId the document
   * @return {@code true} if added; {@code false} if the id is already queued in any state
   */
  boolean enqueue(String documentId);

  /**
   * Moves the oldest pending entry to processing and increments its attempt counter.
   *
   * @return the entry, or empty when there is no work
   */
  Optional<QueueEntry> dequeue();

  /** Records full ingestion. Safe to call for an id that is not in processing. */
  void complete(String documentId);

  /** Records a terminal failure. Safe to call for an id that is not in processing. */
  void fail(String documentId);

  /** Returns a processing entry to the back of pending, keeping its attempt counter. */
  void requeue(String documentId);

  /**
   * Moves every processing entry back to the front of pending. Used at the start of a run and by
   * the scanner, when no other worker can still be holding them.
   *
   * @return ids that were recovered
   */
  List<String> recoverInFlight();

  /**
   * Moves every failed entry back to pending with a fresh attempt counter.
   *
   * @return ids that were retried
   */
  List<String> retryFailed();

  /** Puts a document back to pending whatever its state, resetting its attempt counter. */
  void forceEnqueue(String documentId);

  /** Replaces the whole queue. */
  void regenerate(
      Collection<String> pending, Collection<String> completed, Collection<String> failed);

  Optional<QueueEntry> entry(String documentId);

  QueueSnapshot snapshot();
}
