package com.example.helpdesk.qabot.util;

import com.example.helpdesk.qabot.model.RankedFaq;
import com.example.helpdesk.qabot.model.RankedProduct;
import com.example.helpdesk.qabot.model.ScoredItem;

import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

public final class PromptRenderUtils {
  private PromptRenderUtils() {}

  /**
   * One line per item, at most {@code maxItems} lines. Every field goes through {@code escaper}.
   */
  public static String renderContext(List<? extends ScoredItem> items, int maxItems, UnaryOperator<String> escaper) {
    if (items == null || items.isEmpty() || maxItems <= 0) {
      return "";
    }

    StringBuilder sb = new StringBuilder();
    for (ScoredItem item : items.subList(0, Math.min(maxItems, items.size()))) {
      if (item instanceof RankedProduct product) {
        sb.append("商品名: ").append(escaper.apply(product.name()))
            .append(", 説明: ").append(escaper.apply(product.description()))
            .append(", その他: ").append(escaper.apply(product.notes()))
            .append('\n');
      } else if (item instanceof RankedFaq faq) {
        sb.append("質問: ").append(escaper.apply(faq.question()))
            .append(", 回答: ").append(escaper.apply(faq.answer()))
            .append('\n');
      }
    }
    return sb.toString();
  }

  public static String renderAnswerPrompt(String question, String context) {
    return """
        以下の関連情報に基づいて、質問「%s」への回答を生成してください。

        %s

        回答:""".formatted(Objects.toString(question, ""), Objects.toString(context, ""));
  }
}
