package com.flamingo.ai.docingest.service.chunking;

import com.google.common.base.Utf8;

/** Size of a region of text, in whatever unit a budget is expressed in. */
@FunctionalInterface
public interface TextMeasure {

  /** UTF-8 encoded length. */
  TextMeasure UTF8_BYTES =
      new TextMeasure() {
        @Override
        public long measure(String text, int start, int end) {
          return Utf8.encodedLength(text.subSequence(start, end));
        }

        @Override
        public boolean additive() {
          return true;
        }
      };

  long measure(String text, int start, int end);

  /**
   * Whether the size of a region always equals the sum of the sizes of its parts. Token counts are
   * not additive: BPE merges across the seams.
   */
  default boolean additive() {
    return false;
  }
}
