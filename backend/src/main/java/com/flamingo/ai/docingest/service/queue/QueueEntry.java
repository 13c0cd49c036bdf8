package com.flamingo.ai.docingest.service.queue;

import com.flamingo.ai.docingest.domain.enums.QueueState;

/**
 * A document reference in the work queue.
 *
 * @param documentId the queued document
 * @param state current lifecycle state
 * @param attempts number of times the entry has been dequeued since it was last reset
 */
public record QueueEntry(String documentId, QueueState state, int attempts) {}
