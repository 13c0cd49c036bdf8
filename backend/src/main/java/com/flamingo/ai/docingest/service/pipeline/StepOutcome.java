package com.flamingo.ai.docingest.service.pipeline;

/** What one queue step did with the entry it dequeued. */
public enum StepOutcome {
  /** The queue had no pending entry. */
  NO_WORK,

  /** The document is fully stored. */
  COMPLETED,

  /** The attempt failed and the entry went back to pending. */
  REQUEUED,

  /** The attempt budget is spent; the entry is failed and checkpointed as skipped. */
  FAILED
}
