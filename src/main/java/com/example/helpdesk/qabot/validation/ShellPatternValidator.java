package com.example.helpdesk.qabot.validation;

import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Rejects text that looks like a shell command fragment. The filter is deliberately coarse:
 * ordinary punctuation such as a bare semicolon is rejected too.
 *
 * <p>The semicolon that ends a character reference produced by {@link MarkupEscapeValidator} is
 * not treated as a separator, so text that already went through the sanitizer passes again
 * unchanged. The reference's {@code &} is still screened.
 */
@Slf4j
@Component
public class ShellPatternValidator implements Validator {

  private static final List<Pattern> DANGEROUS_PATTERNS = List.of(
      Pattern.compile(";"),
      Pattern.compile("`"),
      Pattern.compile("\\$\\(.*\\)", Pattern.DOTALL),
      Pattern.compile("\\|"),
      Pattern.compile("&&"),
      Pattern.compile("<.*", Pattern.DOTALL),
      Pattern.compile(">.*", Pattern.DOTALL));

  @Override
  public ValidationStage stage() {
    return ValidationStage.SCREEN;
  }

  @Override
  public void validate(ValidationContext context) {
    String processed = Objects.requireNonNullElse(context.getProcessedInput(), "");
    String screened = MarkupEscapeValidator.CHARACTER_REFERENCE.matcher(processed)
        .replaceAll(reference -> Matcher.quoteReplacement(withoutTerminator(reference.group())));
    for (Pattern pattern : DANGEROUS_PATTERNS) {
      if (pattern.matcher(screened).find()) {
        log.warn("[sanitizer] Rejected input matching dangerous pattern '{}'", pattern.pattern());
        throw new ValidationException("Input contains a disallowed shell pattern.");
      }
    }
  }

  private static String withoutTerminator(String reference) {
    return reference.substring(0, reference.length() - 1);
  }
}
