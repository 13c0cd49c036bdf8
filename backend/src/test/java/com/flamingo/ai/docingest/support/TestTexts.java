package com.flamingo.ai.docingest.support;

import com.flamingo.ai.docingest.service.tokenizer.JtokkitTokenizer;
import com.flamingo.ai.docingest.service.tokenizer.Tokenizer;
import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.EncodingType;

/** Shared fixtures: a real cl100k tokenizer and generated prose with unique sentences. */
public final class TestTexts {

  private static final String[] TOPICS = {
    "river deltas", "orbital mechanics", "medieval trade", "soil chemistry", "jazz harmony",
    "glacier retreat", "compiler design"
  };

  private TestTexts() {}

  public static Tokenizer tokenizer() {
    return new JtokkitTokenizer(
        Encodings.newDefaultEncodingRegistry().getEncoding(EncodingType.CL100K_BASE));
  }

  public static String sentence(int n) {
    return "Sentence "
        + n
        + " discusses "
        + TOPICS[n % TOPICS.length]
        + " and why it matters to the people who study it.";
  }

  /** Paragraphs of {@code sentencesPerParagraph} sentences, separated by blank lines. */
  public static String paragraphs(int paragraphs, int sentencesPerParagraph) {
    StringBuilder text = new StringBuilder();
    int n = 0;
    for (int p = 0; p < paragraphs; p++) {
      if (p > 0) {
        text.append("\n\n");
      }
      for (int s = 0; s < sentencesPerParagraph; s++) {
        if (s > 0) {
          text.append(' ');
        }
        text.append(sentence(n++));
      }
    }
    return text.toString();
  }

  /** Generated prose of at least {@code minTokens} tokens. */
  public static String ofAtLeastTokens(Tokenizer tokenizer, int minTokens) {
    int paragraphs = Math.max(1, minTokens / 80);
    String text = paragraphs(paragraphs, 5);
    while (tokenizer.countTokens(text) < minTokens) {
      paragraphs += Math.max(1, paragraphs / 10);
      text = paragraphs(paragraphs, 5);
    }
    return text;
  }
}
