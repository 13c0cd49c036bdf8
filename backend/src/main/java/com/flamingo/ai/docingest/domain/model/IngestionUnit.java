package com.flamingo.ai.docingest.domain.model;

import com.google.common.base.Utf8;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * A piece of text handed to the ingestion worker: either a whole document (level 0) or a segment
 * produced by the recursive splitter.
 *
 * @param id document id, or {@code parentId#NN} for a segment
 * @param parentId id of the unit this segment was cut from, {@code null} for a document
 * @param rootDocumentId id of the original document
 * @param recursionLevel 0 for a document, parent level + 1 for a segment
 * @param text the content
 */
public record IngestionUnit(
    String id, String parentId, String rootDocumentId, int recursionLevel, String text) {

  /** One {@code #NN} group per recursion level, at the end of the id. */
  private static final Pattern SEGMENT_SUFFIX = Pattern.compile("(#\\d{2,})+");

  private static final Pattern SEGMENT_ID = Pattern.compile(".+" + SEGMENT_SUFFIX.pattern());

  public IngestionUnit {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Unit id must not be blank");
    }
    if (rootDocumentId == null || rootDocumentId.isBlank()) {
      throw new IllegalArgumentException("Root document id must not be blank");
    }
    if (recursionLevel < 0) {
      throw new IllegalArgumentException("Recursion level must be >= 0: " + recursionLevel);
    }
    if (recursionLevel == 0 && parentId != null) {
      throw new IllegalArgumentException("A level-0 unit has no parent");
    }
    if (recursionLevel > 0 && parentId == null) {
      throw new IllegalArgumentException("A segment must reference its parent");
    }
    text = text == null ? "" : text;
  }

  public static IngestionUnit ofDocument(String documentId, String text) {
    return new IngestionUnit(documentId, null, documentId, 0, text);
  }

  /**
   * Creates the {@code ordinal}-th (1-based) segment of this unit.
   *
   * @param ordinal 1-based segment number
   * @param segmentText text of the segment
   * @return the segment, one recursion level deeper
   */
  public IngestionUnit segment(int ordinal, String segmentText) {
    String segmentId = id + "#" + String.format(Locale.ROOT, "%02d", ordinal);
    return new IngestionUnit(segmentId, id, rootDocumentId, recursionLevel + 1, segmentText);
  }

  /**
   * Whether {@code unitId} names a segment. A document id may itself contain {@code #}, as in
   * {@code notes#1.txt}; only a trailing run of {@code #NN} groups marks a segment.
   */
  public static boolean isSegmentId(String unitId) {
    return SEGMENT_ID.matcher(unitId).matches();
  }

  /** Whether {@code unitId} is {@code documentId} itself or one of its segments at any depth. */
  public static boolean belongsTo(String unitId, String documentId) {
    if (!unitId.startsWith(documentId)) {
      return false;
    }
    String rest = unitId.substring(documentId.length());
    return rest.isEmpty() || SEGMENT_SUFFIX.matcher(rest).matches();
  }

  public long byteSize() {
    return Utf8.encodedLength(text);
  }

  public boolean isSegment() {
    return recursionLevel > 0;
  }
}
