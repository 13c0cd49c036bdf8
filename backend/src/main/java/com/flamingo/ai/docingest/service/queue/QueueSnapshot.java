package com.flamingo.ai.docingest.service.queue;

import java.util.List;

/** Point-in-time copy of the four queue lists. */
public record QueueSnapshot(
    List<String> pending, List<String> processing, List<String> completed, List<String> failed) {

  public QueueSnapshot {
    pending = List.copyOf(pending);
    processing = List.copyOf(processing);
    completed = List.copyOf(completed);
    failed = List.copyOf(failed);
  }

  public int total() {
    return pending.size() + processing.size() + completed.size() + failed.size();
  }

  public boolean isDrained() {
    return pending.isEmpty() && processing.isEmpty();
  }
}
