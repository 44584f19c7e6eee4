package com.example.helpdesk.qabot.validation;

/** Identifies where in the sanitizer chain a validator is executed. */
public enum ValidationStage {
  /** Presence checks and whitespace normalization. */
  NORMALIZE,
  /** Rejection of text carrying disallowed patterns. Runs on unescaped text. */
  SCREEN,
  /** Escaping of markup-significant characters. */
  ESCAPE,
  /** Length limits, applied to the escaped text. */
  LIMIT
}
