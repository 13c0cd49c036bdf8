package com.flamingo.ai.docingest.service.tokenizer;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.docingest.support.TestTexts;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("JtokkitTokenizer Tests")
class JtokkitTokenizerTest {

  private final Tokenizer tokenizer = TestTexts.tokenizer();

  @Test
  @DisplayName("should count the tokens it encodes")
  void shouldCountTokensConsistentlyWithEncode() {
    String text = "Retrieval-augmented generation needs well sized passages.";

    List<Integer> tokens = tokenizer.encode(text);

    assertThat(tokens).isNotEmpty();
    assertThat(tokenizer.countTokens(text)).isEqualTo(tokens.size());
    assertThat(tokenizer.decode(tokens)).isEqualTo(text);
  }

  @Test
  @DisplayName("should count tokens, not characters")
  void shouldCountTokensNotCharacters() {
    String text = "hello world";

    assertThat(tokenizer.countTokens(text)).isEqualTo(2);
  }

  @Test
  @DisplayName("should treat null and empty text as zero tokens")
  void shouldTreatEmptyTextAsZeroTokens() {
    assertThat(tokenizer.countTokens("")).isZero();
    assertThat(tokenizer.countTokens(null)).isZero();
    assertThat(tokenizer.encode("")).isEmpty();
  }
}
