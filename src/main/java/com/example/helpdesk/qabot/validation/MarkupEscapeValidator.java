package com.example.helpdesk.qabot.validation;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Escapes characters that are significant in HTML so the text can be embedded in generated
 * markup or prompts. An ampersand that already starts a reference is kept as is.
 */
@Component
public class MarkupEscapeValidator implements Validator {

  public static final Pattern CHARACTER_REFERENCE = Pattern.compile("&(?:amp|lt|gt|quot|#39);");

  @Override
  public ValidationStage stage() {
    return ValidationStage.ESCAPE;
  }

  @Override
  public void validate(ValidationContext context) {
    context.setProcessedInput(escape(context.getProcessedInput()));
  }

  public static String escape(String text) {
    String source = Objects.requireNonNullElse(text, "");
    StringBuilder sb = new StringBuilder(source.length() + 16);
    Matcher reference = CHARACTER_REFERENCE.matcher(source);
    for (int i = 0; i < source.length(); i++) {
      char c = source.charAt(i);
      switch (c) {
        case '&' -> {
          reference.region(i, source.length());
          sb.append(reference.lookingAt() ? "&" : "&amp;");
        }
        case '<' -> sb.append("&lt;");
        case '>' -> sb.append("&gt;");
        case '"' -> sb.append("&quot;");
        case '\'' -> sb.append("&#39;");
        default -> sb.append(c);
      }
    }
    return sb.toString();
  }
}
