package com.flamingo.ai.docingest.service.tokenizer;

import java.util.List;

/**
 * Converts text to a countable token sequence and back. Token counts size chunks, because the
 * embedding service limits its input in tokens rather than characters.
 */
public interface Tokenizer {

  int countTokens(String text);

  List<Integer> encode(String text);

  String decode(List<Integer> tokens);
}
