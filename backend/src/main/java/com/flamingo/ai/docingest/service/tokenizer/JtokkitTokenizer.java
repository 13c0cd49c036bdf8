package com.flamingo.ai.docingest.service.tokenizer;

import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.IntArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** {@link Tokenizer} backed by a JTokkit BPE encoding (cl100k_base by default). */
@Component
@RequiredArgsConstructor
public class JtokkitTokenizer implements Tokenizer {

  private final Encoding encoding;

  @Override
  public int countTokens(String text) {
    if (text == null || text.isEmpty()) {
      return 0;
    }
    return encoding.countTokensOrdinary(text);
  }

  @Override
  public List<Integer> encode(String text) {
    if (text == null || text.isEmpty()) {
      return List.of();
    }
    return encoding.encodeOrdinary(text).boxed();
  }

  @Override
  public String decode(List<Integer> tokens) {
    IntArrayList ids = new IntArrayList(tokens.size());
    for (Integer token : tokens) {
      ids.add(token);
    }
    return encoding.decode(ids);
  }
}
