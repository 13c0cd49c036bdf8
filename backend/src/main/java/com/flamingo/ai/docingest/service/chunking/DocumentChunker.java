package com.flamingo.ai.docingest.service.chunking;

import com.flamingo.ai.docingest.domain.model.Chunk;
import java.util.List;

/**
 * Splits the text of one ingestion unit into ordered, token-bounded {@link Chunk}s ready for
 * embedding.
 *
 * <p>Implementations must be stateless and safe for concurrent use. A chunker only chunks: it does
 * not read files or embed.
 */
public interface DocumentChunker {

  /**
   * Produces chunks from the unit text.
   *
   * @param unitId id of the unit, used to derive chunk ids
   * @param text the unit text
   * @param maxTokens token budget per chunk
   * @param overlapTokens token budget for context repeated from the previous chunk
   * @return ordered list of chunks, empty for blank text
   */
  List<Chunk> chunk(String unitId, String text, int maxTokens, int overlapTokens);
}
