package com.example.helpdesk.qabot.validation;

import org.springframework.stereotype.Component;

/** Rejects null or blank input and strips surrounding whitespace from the rest. */
@Component
public class NotBlankInputValidator implements Validator {

  @Override
  public ValidationStage stage() {
    return ValidationStage.NORMALIZE;
  }

  @Override
  public void validate(ValidationContext context) {
    String rawInput = context.getRawInput();
    if (rawInput == null || rawInput.isBlank()) {
      throw new ValidationException("User input must not be blank.");
    }
    context.setProcessedInput(rawInput.strip());
  }
}
