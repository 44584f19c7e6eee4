package com.example.helpdesk.qabot.validation;

import com.example.helpdesk.qabot.config.QaProperties;
import java.util.Objects;
import java.util.regex.Matcher;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Ensures the processed input does not exceed a maximum length. The cut is a hard cut, except
 * that a character reference split by it is dropped whole.
 */
@Component
public class MaxCharsValidator implements Validator {

  private final int maxChars;

  @Autowired
  public MaxCharsValidator(QaProperties properties) {
    this(properties.getSanitizer().getMaxChars());
  }

  public MaxCharsValidator(int maxChars) {
    if (maxChars <= 0) {
      throw new IllegalArgumentException("maxChars must be positive");
    }
    this.maxChars = maxChars;
  }

  @Override
  public ValidationStage stage() {
    return ValidationStage.LIMIT;
  }

  @Override
  public void validate(ValidationContext context) {
    String processed = Objects.requireNonNullElse(context.getProcessedInput(), "");
    if (processed.length() <= maxChars) {
      context.setProcessedInput(processed);
      return;
    }

    String truncated = processed.substring(0, maxChars);
    int ampersand = truncated.lastIndexOf('&');
    if (ampersand >= 0 && truncated.indexOf(';', ampersand) < 0) {
      Matcher reference = MarkupEscapeValidator.CHARACTER_REFERENCE.matcher(processed);
      reference.region(ampersand, processed.length());
      if (reference.lookingAt()) {
        truncated = truncated.substring(0, ampersand);
      }
    }
    context.setProcessedInput(truncated.strip());
    context.addNotice(String.format("Input truncated to %d characters.", maxChars));
  }
}
