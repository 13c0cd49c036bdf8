package com.flamingo.ai.docingest.domain.enums;

/** Lifecycle state of a document in the work queue. */
public enum QueueState {
  /** Discovered by a scan, waiting for a worker. */
  PENDING,

  /** Held by a worker. Treated as pending again once the holder is gone. */
  PROCESSING,

  /** Every chunk of the document is stored. */
  COMPLETED,

  /** Attempt budget exhausted; left for operator inspection. */
  FAILED
}
