package com.example.helpdesk.qabot.validation;

/** Contract for the steps the {@link TextSanitizer} runs over incoming text. */
public interface Validator {

  /** The stage in which the validator should be executed. */
  ValidationStage stage();

  /**
   * Applies the validation logic and optionally mutates the provided context.
   *
   * @throws ValidationException when the text must be rejected as a whole
   */
  void validate(ValidationContext context);
}
