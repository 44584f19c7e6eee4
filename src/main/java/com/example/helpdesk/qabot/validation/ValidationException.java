package com.example.helpdesk.qabot.validation;

import java.util.Objects;

/** Thrown by a {@link Validator} when the text is rejected as a whole. */
public class ValidationException extends RuntimeException {

  public ValidationException(String message) {
    super(Objects.requireNonNull(message, "message"));
  }
}
