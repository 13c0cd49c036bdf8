package com.flamingo.ai.docingest.domain.model;

import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;

/**
 * A contiguous passage of a unit, sized for one embedding call.
 *
 * @param unitId id of the unit the chunk was cut from
 * @param index 0-based position within the unit
 * @param text passage text, always a substring of the unit text
 * @param tokenCount tokens in {@code text}
 * @param overlapTokens tokens at the start of {@code text} shared with the previous chunk
 */
public record Chunk(String unitId, int index, String text, int tokenCount, int overlapTokens) {

  public Chunk {
    if (index < 0) {
      throw new IllegalArgumentException("Chunk index must be >= 0: " + index);
    }
    if (overlapTokens < 0 || overlapTokens > tokenCount) {
      throw new IllegalArgumentException(
          "Overlap " + overlapTokens + " out of range for chunk of " + tokenCount + " tokens");
    }
  }

  /** Stable id derived from the parent unit and the ordinal: {@code unitId_index}. */
  public String id() {
    return idFor(unitId, index);
  }

  public String contentHash() {
    return Hashing.sha256().hashString(text, StandardCharsets.UTF_8).toString();
  }

  public static String idFor(String unitId, int index) {
    return unitId + "_" + index;
  }
}
