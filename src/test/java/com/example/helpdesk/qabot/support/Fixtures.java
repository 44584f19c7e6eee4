package com.example.helpdesk.qabot.support;

import com.example.helpdesk.qabot.cache.ResourceCache;
import com.example.helpdesk.qabot.cache.ResourceLoadException;
import com.example.helpdesk.qabot.model.FaqEntry;
import com.example.helpdesk.qabot.model.ProductEntry;
import com.example.helpdesk.qabot.model.Token;
import com.example.helpdesk.qabot.service.AnswerGenerator;
import com.example.helpdesk.qabot.tokenizer.MorphologicalTokenizer;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/** Shared builders for tests that need a populated {@link ResourceCache}. */
public final class Fixtures {
  private Fixtures() {}

  /** Splits on spaces and tags every word as a noun. */
  public static final MorphologicalTokenizer SPACE_NOUN_TOKENIZER = (text, maxTokens) ->
      Arrays.stream(text.split(" "))
          .filter(word -> !word.isEmpty())
          .limit(maxTokens)
          .map(word -> new Token(word, "名詞"))
          .toList();

  public static ProductEntry product(String name, String description) {
    return new ProductEntry(name, description, "", "");
  }

  public static FaqEntry faq(String question, String answer, String... relatedWords) {
    return new FaqEntry(question, answer, List.of(relatedWords), "");
  }

  public static ResourceCache cache(List<ProductEntry> products,
                                    List<FaqEntry> faqs,
                                    MorphologicalTokenizer tokenizer,
                                    AnswerGenerator generator) {
    return new ResourceCache(
        () -> products,
        () -> faqs,
        () -> {
          if (tokenizer == null) {
            throw ResourceLoadException.permanent("no dictionary in tests");
          }
          return tokenizer;
        },
        () -> {
          if (generator == null) {
            throw ResourceLoadException.permanent("no api key in tests");
          }
          return generator;
        },
        Duration.ofSeconds(300),
        Clock.systemUTC());
  }
}
