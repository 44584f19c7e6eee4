package com.example.helpdesk.qabot.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Carries the user supplied text through the validation stages. Validators can mutate the
 * processed text and attach notices.
 */
public class ValidationContext {

  private final String rawInput;
  private String processedInput;
  private final List<String> notices = new ArrayList<>();

  public ValidationContext(String rawInput) {
    this.rawInput = rawInput;
    this.processedInput = rawInput;
  }

  public String getRawInput() {
    return rawInput;
  }

  public String getProcessedInput() {
    return processedInput;
  }

  public void setProcessedInput(String processedInput) {
    this.processedInput = processedInput;
  }

  public void addNotice(String notice) {
    notices.add(Objects.requireNonNull(notice, "notice"));
  }

  public List<String> getNotices() {
    return Collections.unmodifiableList(notices);
  }
}
