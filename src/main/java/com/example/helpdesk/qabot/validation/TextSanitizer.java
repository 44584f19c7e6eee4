package com.example.helpdesk.qabot.validation;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs all registered {@link Validator} beans in stage order over a piece of user text. Any
 * rejection yields an empty string; callers treat that as "no usable input".
 */
@Slf4j
@Service
public class TextSanitizer {

  private final List<Validator> orderedValidators;

  public TextSanitizer(List<Validator> validators) {
    List<Validator> safeValidators = validators == null ? List.of() : validators;
    this.orderedValidators = safeValidators.stream()
        .filter(Objects::nonNull)
        .sorted(Comparator.comparing(Validator::stage))
        .toList();
  }

  /** Sanitizer with the standard chain and the given length limit. */
  public static TextSanitizer withMaxChars(int maxChars) {
    return new TextSanitizer(List.of(
        new NotBlankInputValidator(),
        new ShellPatternValidator(),
        new MarkupEscapeValidator(),
        new MaxCharsValidator(maxChars)));
  }

  public static TextSanitizer withDefaults() {
    return withMaxChars(1000);
  }

  public String sanitize(String raw) {
    ValidationContext context = new ValidationContext(raw);
    try {
      for (Validator validator : orderedValidators) {
        validator.validate(context);
      }
    } catch (ValidationException e) {
      log.debug("[sanitizer] Input rejected: {}", e.getMessage());
      return "";
    }
    for (String notice : context.getNotices()) {
      log.debug("[sanitizer] {}", notice);
    }
    return Objects.requireNonNullElse(context.getProcessedInput(), "");
  }

  /** Escapes markup without any of the rejection rules; used for corpus fields. */
  public String escape(String text) {
    return MarkupEscapeValidator.escape(text);
  }
}
