package com.example.helpdesk.qabot.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class MaxCharsValidatorTest {

  @Test
  void shouldLeaveShortInputUntouched() {
    ValidationContext context = new ValidationContext("short");
    MaxCharsValidator validator = new MaxCharsValidator(10);

    validator.validate(context);

    assertThat(context.getProcessedInput()).isEqualTo("short");
    assertThat(context.getNotices()).isEmpty();
  }

  @Test
  void shouldTruncateWhenExceedingLimit() {
    ValidationContext context = new ValidationContext("abcdefghij");
    MaxCharsValidator validator = new MaxCharsValidator(5);

    validator.validate(context);

    assertThat(context.getProcessedInput()).isEqualTo("abcde");
    assertThat(context.getNotices())
        .singleElement()
        .isEqualTo("Input truncated to 5 characters.");
  }

  @Test
  void shouldDropCharacterReferenceSplitByTheCut() {
    ValidationContext context = new ValidationContext("abc&quot;def");
    MaxCharsValidator validator = new MaxCharsValidator(6);

    validator.validate(context);

    assertThat(context.getProcessedInput()).isEqualTo("abc");
  }

  @Test
  void shouldKeepCompleteCharacterReferenceBeforeTheCut() {
    ValidationContext context = new ValidationContext("a&amp;bcdef");
    MaxCharsValidator validator = new MaxCharsValidator(7);

    validator.validate(context);

    assertThat(context.getProcessedInput()).isEqualTo("a&amp;b");
  }

  @Test
  void shouldRejectNonPositiveLimit() {
    assertThatThrownBy(() -> new MaxCharsValidator(0))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
