package com.example.helpdesk.qabot.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class NotBlankInputValidatorTest {

  private final NotBlankInputValidator validator = new NotBlankInputValidator();

  @Test
  void shouldRejectNullInput() {
    assertThatThrownBy(() -> validator.validate(new ValidationContext(null)))
        .isInstanceOf(ValidationException.class)
        .hasMessage("User input must not be blank.");
  }

  @Test
  void shouldRejectWhitespaceOnlyInput() {
    assertThatThrownBy(() -> validator.validate(new ValidationContext(" \t　 ")))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  void shouldStripSurroundingWhitespace() {
    ValidationContext context = new ValidationContext("  送料はいくら？ \n");

    validator.validate(context);

    assertThat(context.getProcessedInput()).isEqualTo("送料はいくら？");
  }
}
