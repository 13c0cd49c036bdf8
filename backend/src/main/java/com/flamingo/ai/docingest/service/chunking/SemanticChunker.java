package com.flamingo.ai.docingest.service.chunking;

import com.flamingo.ai.docingest.domain.model.Chunk;
import com.flamingo.ai.docingest.service.tokenizer.Tokenizer;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * {@link DocumentChunker} that cuts on paragraph, line, sentence and clause boundaries, in that
 * order of preference, and sizes chunks with the {@link Tokenizer}.
 *
 * <p>Text that already fits the budget becomes a single chunk. Otherwise chunks are packed by
 * {@link BoundarySplitter}: each one holds at most {@code maxTokens} tokens and starts with up to
 * {@code overlapTokens} tokens copied from the end of its predecessor. A run-on unit with no usable
 * boundary is emitted whole, over budget, rather than truncated.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SemanticChunker implements DocumentChunker {

  private final Tokenizer tokenizer;

  @Override
  public List<Chunk> chunk(String unitId, String text, int maxTokens, int overlapTokens) {
    if (maxTokens <= 0) {
      throw new IllegalArgumentException("maxTokens must be > 0: " + maxTokens);
    }
    if (overlapTokens < 0 || overlapTokens >= maxTokens) {
      throw new IllegalArgumentException(
          "overlapTokens must be >= 0 and < maxTokens (" + maxTokens + "): " + overlapTokens);
    }
    if (text == null || text.isBlank()) {
      return List.of();
    }

    String stripped = text.strip();
    int totalTokens = tokenizer.countTokens(stripped);
    if (totalTokens <= maxTokens) {
      return List.of(new Chunk(unitId, 0, stripped, totalTokens, 0));
    }

    TextMeasure tokens =
        (source, start, end) -> tokenizer.countTokens(source.substring(start, end));
    List<BoundarySplitter.Window> windows =
        BoundarySplitter.split(text, tokens, maxTokens, overlapTokens);

    List<Chunk> chunks = new ArrayList<>(windows.size());
    int oversized = 0;
    for (BoundarySplitter.Window window : windows) {
      int size = (int) window.size();
      if (size > maxTokens) {
        oversized++;
      }
      chunks.add(
          new Chunk(
              unitId,
              chunks.size(),
              window.text(text),
              size,
              (int) Math.min(window.overlapSize(), size)));
    }

    if (oversized > 0) {
      log.warn(
          "{}: {} chunk(s) hold an indivisible unit above {} tokens and were kept whole",
          unitId,
          oversized,
          maxTokens);
    }
    log.debug(
        "SemanticChunker produced {} chunks from {} tokens for {}",
        chunks.size(),
        totalTokens,
        unitId);
    return chunks;
  }
}
