package com.example.helpdesk.qabot.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.helpdesk.qabot.cache.ResourceCache;
import com.example.helpdesk.qabot.model.RankedFaq;
import com.example.helpdesk.qabot.model.RankedProduct;
import com.example.helpdesk.qabot.model.ScoredItem;
import com.example.helpdesk.qabot.support.Fixtures;
import com.example.helpdesk.qabot.validation.TextSanitizer;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AnswerComposerTest {

  private static final List<ScoredItem> ITEMS = List.of(
      new RankedProduct("電気ケトル", "1.0L", "保証1年", "https://example.com/kettle", 7),
      new RankedFaq("返品方法は？", "30日以内", "", 8));

  @Mock
  private AnswerGenerator generator;

  private AnswerComposer composer(AnswerGenerator answerGenerator) {
    ResourceCache cache = Fixtures.cache(List.of(), List.of(), null, answerGenerator);
    return new AnswerComposer(TextSanitizer.withDefaults(), cache, 8);
  }

  @Test
  void invalidQuestionSkipsGeneration() {
    assertThat(composer(generator).compose("  ", ITEMS)).isEqualTo(AnswerComposer.INVALID_INPUT_MESSAGE);
    assertThat(composer(generator).compose("a | b", ITEMS)).isEqualTo(AnswerComposer.INVALID_INPUT_MESSAGE);
    verify(generator, never()).generate(anyString());
  }

  @Test
  void missingModelSkipsGeneration() {
    assertThat(composer(null).compose("返品できますか", ITEMS)).isEqualTo(AnswerComposer.MODEL_NOT_LOADED_MESSAGE);
  }

  @Test
  void noRankedItemsSkipsGeneration() {
    assertThat(composer(generator).compose("返品できますか", List.of()))
        .isEqualTo(AnswerComposer.NO_RELATED_INFO_MESSAGE);
    verify(generator, never()).generate(anyString());
  }

  @Test
  void promptEmbedsQuestionAndRenderedItems() {
    when(generator.generate(anyString())).thenReturn("  30日以内なら返品できます。\n");

    String answer = composer(generator).compose("返品できますか", ITEMS);

    assertThat(answer).isEqualTo("30日以内なら返品できます。");
    ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
    verify(generator).generate(prompt.capture());
    assertThat(prompt.getValue())
        .startsWith("以下の関連情報に基づいて、質問「返品できますか」への回答を生成してください。")
        .contains("商品名: 電気ケトル, 説明: 1.0L, その他: 保証1年")
        .contains("質問: 返品方法は？, 回答: 30日以内")
        .endsWith("回答:");
  }

  @Test
  void contextIsLimitedToEightItems() {
    List<ScoredItem> items = new ArrayList<>();
    for (int i = 0; i < 10; i++) {
      items.add(new RankedProduct("item-0" + i, "", "", "", 5));
    }
    when(generator.generate(anyString())).thenReturn("ok");

    composer(generator).compose("どれがおすすめ？", items);

    ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
    verify(generator).generate(prompt.capture());
    assertThat(prompt.getValue()).contains("item-07").doesNotContain("item-08", "item-09");
  }

  @Test
  void corpusFieldsAreEscaped() {
    when(generator.generate(anyString())).thenReturn("ok");

    composer(generator).compose("タグ", List.of(new RankedProduct("<b>ケトル</b>", "\"静音\"", "", "", 5)));

    ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
    verify(generator).generate(prompt.capture());
    assertThat(prompt.getValue())
        .contains("&lt;b&gt;ケトル&lt;/b&gt;")
        .contains("&quot;静音&quot;")
        .doesNotContain("<b>");
  }

  @Test
  void generatorFailureBecomesFixedMessage() {
    when(generator.generate(anyString())).thenThrow(new IllegalStateException("quota exceeded"));

    assertThat(composer(generator).compose("返品できますか", ITEMS))
        .isEqualTo(AnswerComposer.GENERATION_FAILED_MESSAGE);
  }

  @Test
  void nullAnswerBecomesFixedMessage() {
    when(generator.generate(anyString())).thenReturn(null);

    assertThat(composer(generator).compose("返品できますか", ITEMS))
        .isEqualTo(AnswerComposer.GENERATION_FAILED_MESSAGE);
  }
}
