package com.example.helpdesk.qabot.keyword;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class WhitespaceKeywordStrategyTest {

  private final WhitespaceKeywordStrategy strategy = new WhitespaceKeywordStrategy();

  @Test
  void splitsOnWhitespaceAndStripsEdgePunctuation() {
    assertThat(strategy.extract("電気ケトル、 保証は？ (延長)"))
        .containsExactlyInAnyOrder("電気ケトル", "保証は", "延長");
  }

  @Test
  void dropsParticlesAndSingleCharacters() {
    assertThat(strategy.extract("ケトル から の a から 保証")).containsExactlyInAnyOrder("ケトル", "保証");
  }

  @Test
  void deduplicates() {
    assertThat(strategy.extract("返品 返品　返品")).containsExactly("返品");
  }

  @Test
  void blankTextYieldsNothing() {
    assertThat(strategy.extract("  ")).isEmpty();
  }
}
