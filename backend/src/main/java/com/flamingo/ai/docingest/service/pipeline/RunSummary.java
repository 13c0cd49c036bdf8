package com.flamingo.ai.docingest.service.pipeline;

import com.flamingo.ai.docingest.service.queue.QueueSnapshot;

/**
 * Totals for one {@code process} run.
 *
 * @param steps entries dequeued
 * @param completed entries completed
 * @param requeued entries sent back to pending
 * @param failed entries that ended failed
 * @param queue queue state after the run
 */
public record RunSummary(int steps, int completed, int requeued, int failed, QueueSnapshot queue) {}
