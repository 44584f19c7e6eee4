package com.example.helpdesk.qabot.keyword;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.helpdesk.qabot.cache.ResourceCache;
import com.example.helpdesk.qabot.model.Token;
import com.example.helpdesk.qabot.support.Fixtures;
import com.example.helpdesk.qabot.tokenizer.MorphologicalTokenizer;
import com.example.helpdesk.qabot.validation.TextSanitizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class KeywordExtractorTest {

  private final TextSanitizer sanitizer = TextSanitizer.withDefaults();

  private KeywordExtractor extractor(MorphologicalTokenizer tokenizer, int maxTokens, int maxKeywords) {
    ResourceCache cache = Fixtures.cache(List.of(), List.of(), tokenizer, null);
    return new KeywordExtractor(sanitizer, cache, new WhitespaceKeywordStrategy(), maxTokens, maxKeywords);
  }

  @Test
  void keepsOnlyNounsAndAdjectivesLongerThanOneCharacter() {
    MorphologicalTokenizer tokenizer = (text, max) -> List.of(
        new Token("青い", "形容詞"),
        new Token("ウィジェット", "名詞"),
        new Token("を", "助詞"),
        new Token("買い", "動詞"),
        new Token("物", "名詞"),
        new Token("ウィジェット", "名詞"));

    Set<String> keywords = extractor(tokenizer, 100, 20).extract("青いウィジェットを買い物");

    assertThat(keywords).containsExactlyInAnyOrder("青い", "ウィジェット");
  }

  @Test
  void passesTokenCapToTheTokenizer() {
    AtomicInteger requested = new AtomicInteger();
    MorphologicalTokenizer tokenizer = (text, max) -> {
      requested.set(max);
      return Fixtures.SPACE_NOUN_TOKENIZER.tokenize(text, max);
    };

    Set<String> keywords = extractor(tokenizer, 3, 20).extract("aa bb cc dd ee");

    assertThat(requested.get()).isEqualTo(3);
    assertThat(keywords).containsExactlyInAnyOrder("aa", "bb", "cc");
  }

  @Test
  void capsTheNumberOfKeywords() {
    List<String> words = new ArrayList<>();
    for (int i = 10; i < 40; i++) {
      words.add("w" + i);
    }

    Set<String> keywords = extractor(Fixtures.SPACE_NOUN_TOKENIZER, 100, 20).extract(String.join(" ", words));

    assertThat(keywords).hasSize(20);
  }

  @Test
  void fallsBackToWhitespaceSplittingWithoutTokenizer() {
    Set<String> keywords = extractor(null, 100, 20).extract("電気ケトル の 保証");

    assertThat(keywords).containsExactlyInAnyOrder("電気ケトル", "保証");
  }

  @Test
  void characterReferencesDoNotBecomeKeywords() {
    KeywordExtractor extractor = extractor(Fixtures.SPACE_NOUN_TOKENIZER, 100, 20);

    assertThat(extractor.extract("Tom's ケトル")).containsExactlyInAnyOrder("Tom", "ケトル");
    assertThat(extractor.extract("\"静音\" ケトル & 保証")).containsExactlyInAnyOrder("静音", "ケトル", "保証");
  }

  @Test
  void fallbackIgnoresCharacterReferencesToo() {
    Set<String> keywords = extractor(null, 100, 20).extract("\"静音\" ケトル の 保証");

    assertThat(keywords).containsExactlyInAnyOrder("静音", "ケトル", "保証");
  }

  @Test
  void rejectedInputYieldsNoKeywords() {
    KeywordExtractor extractor = extractor(Fixtures.SPACE_NOUN_TOKENIZER, 100, 20);

    assertThat(extractor.extract("")).isEmpty();
    assertThat(extractor.extract("ケトル; rm -rf /")).isEmpty();
  }
}
