package com.flamingo.ai.docingest.elasticsearch;

/**
 * Outcome of an insert-if-absent batch.
 *
 * @param inserted records newly written
 * @param alreadyPresent records whose id already existed and were left untouched
 */
public record UpsertResult(int inserted, int alreadyPresent) {

  public static UpsertResult empty() {
    return new UpsertResult(0, 0);
  }
}
