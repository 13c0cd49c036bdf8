package com.flamingo.ai.docingest.service.chunking;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cuts text into windows that fit a size budget, placing every cut on a natural-language boundary.
 *
 * <p>The text is first flattened into units: paragraphs (blank-line separated), and, for any
 * paragraph that alone exceeds the budget, its lines, then sentences, then clauses. A unit that is
 * still too large at clause level is indivisible and is kept whole. Units are then packed greedily
 * into windows. When a window closes, the next one is seeded with the trailing units of the closed
 * window, walking backward unit by unit while they fit the overlap budget.
 *
 * <p>Windows are always regions of the original text, so the overlap of window {@code i + 1} is
 * literally the tail of window {@code i}, and no cut ever falls inside a word.
 *
 * <p>Shared by {@link SemanticChunker} (token budget, with overlap) and the recursive splitter
 * (byte budget, no overlap).
 */
public final class BoundarySplitter {

  static final Pattern PARAGRAPH = Pattern.compile("\\n\\s*\\n");
  static final Pattern LINE = Pattern.compile("\\r?\\n");
  static final Pattern SENTENCE = Pattern.compile("(?<=[.!?。！？])\\s+");
  static final Pattern CLAUSE = Pattern.compile("(?<=[,;:，；：])\\s+");

  private static final List<Pattern> LEVELS = List.of(PARAGRAPH, LINE, SENTENCE, CLAUSE);

  private BoundarySplitter() {}

  /**
   * A region {@code [start, end)} of the input text.
   *
   * @param start first character
   * @param end one past the last character
   * @param overlapEnd end of the leading region shared with the previous window; equals {@code
   *     start} when nothing is shared
   * @param size measure of the whole window
   * @param overlapSize measure of the shared region
   */
  public record Window(int start, int end, int overlapEnd, long size, long overlapSize) {

    public String text(String source) {
      return source.substring(start, end);
    }

    public boolean hasOverlap() {
      return overlapEnd > start;
    }
  }

  private record Unit(int start, int end, long size) {}

  /**
   * Splits {@code text} into windows of at most {@code maxSize}, except that a single indivisible
   * unit larger than the budget is returned whole in a window of its own.
   *
   * @param text the text to split
   * @param measure how region sizes are computed
   * @param maxSize window budget
   * @param overlapSize budget for the region repeated at the start of the next window
   * @return windows in text order; empty when the text is blank
   */
  public static List<Window> split(
      String text, TextMeasure measure, long maxSize, long overlapSize) {
    if (maxSize <= 0) {
      throw new IllegalArgumentException("maxSize must be > 0: " + maxSize);
    }
    if (overlapSize < 0 || overlapSize >= maxSize) {
      throw new IllegalArgumentException(
          "overlapSize must be >= 0 and < maxSize (" + maxSize + "): " + overlapSize);
    }

    List<Unit> units = new ArrayList<>();
    collectUnits(text, 0, text.length(), 0, measure, maxSize, units);
    if (units.isEmpty()) {
      return List.of();
    }
    return pack(text, units, measure, maxSize, overlapSize);
  }

  /** Flattens {@code [start, end)} into units no larger than {@code budget} where possible. */
  private static void collectUnits(
      String text,
      int start,
      int end,
      int level,
      TextMeasure measure,
      long budget,
      List<Unit> out) {
    Matcher matcher = LEVELS.get(level).matcher(text);
    matcher.region(start, end);
    matcher.useTransparentBounds(true);

    int pieceStart = start;
    while (matcher.find()) {
      addPiece(text, pieceStart, matcher.start(), level, measure, budget, out);
      pieceStart = matcher.end();
    }
    addPiece(text, pieceStart, end, level, measure, budget, out);
  }

  private static void addPiece(
      String text,
      int start,
      int end,
      int level,
      TextMeasure measure,
      long budget,
      List<Unit> out) {
    while (start < end && Character.isWhitespace(text.charAt(start))) {
      start++;
    }
    while (end > start && Character.isWhitespace(text.charAt(end - 1))) {
      end--;
    }
    if (start == end) {
      return;
    }
    long size = measure.measure(text, start, end);
    if (size <= budget || level == LEVELS.size() - 1) {
      out.add(new Unit(start, end, size));
    } else {
      collectUnits(text, start, end, level + 1, measure, budget, out);
    }
  }

  private static List<Window> pack(
      String text, List<Unit> units, TextMeasure measure, long maxSize, long overlapSize) {
    int n = units.size();
    long[] gaps = new long[n];
    for (int i = 1; i < n; i++) {
      gaps[i] = measure.measure(text, units.get(i - 1).end(), units.get(i).start());
    }

    List<Window> windows = new ArrayList<>();
    int start = 0;
    int firstNew = 0;
    while (firstNew < n) {
      // drop carried-over units until the overlap and the first new unit fit together
      while (start < firstNew && span(text, units, measure, start, firstNew + 1) > maxSize) {
        start++;
      }

      int end = firstNew + 1;
      long size =
          start == firstNew
              ? units.get(firstNew).size()
              : span(text, units, measure, start, firstNew + 1);
      while (end < n) {
        long estimate = size + gaps[end] + units.get(end).size();
        if (estimate > maxSize) {
          if (measure.additive()) {
            break;
          }
          long exact = span(text, units, measure, start, end + 1);
          if (exact > maxSize) {
            break;
          }
          size = exact;
        } else {
          size = estimate;
        }
        end++;
      }

      if (!measure.additive()) {
        size = span(text, units, measure, start, end);
        while (size > maxSize && end - 1 > firstNew) {
          end--;
          size = span(text, units, measure, start, end);
        }
      }

      boolean shared = start < firstNew;
      int overlapEnd = shared ? units.get(firstNew - 1).end() : units.get(start).start();
      long sharedSize = shared ? span(text, units, measure, start, firstNew) : 0;
      windows.add(
          new Window(
              units.get(start).start(), units.get(end - 1).end(), overlapEnd, size, sharedSize));
      if (end >= n) {
        break;
      }

      int seed = end;
      if (overlapSize > 0) {
        while (seed - 1 > start && span(text, units, measure, seed - 1, end) <= overlapSize) {
          seed--;
        }
      }
      start = seed;
      firstNew = end;
    }
    return windows;
  }

  /** Measure of the region covering units {@code [from, to)}. */
  private static long span(String text, List<Unit> units, TextMeasure measure, int from, int to) {
    if (to - from == 1) {
      return units.get(from).size();
    }
    return measure.measure(text, units.get(from).start(), units.get(to - 1).end());
  }
}
