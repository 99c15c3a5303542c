package io.applyflow.forms.formdefinition;

import java.math.BigDecimal;
import java.util.List;

/**
 * Answer constraints. {@code min} and {@code max} bound the length of text answers and the value
 * of number answers.
 */
public record Validation(
    BigDecimal min, BigDecimal max, String pattern, List<String> allowedTypes) {

  public Validation {
    allowedTypes = allowedTypes == null ? null : List.copyOf(allowedTypes);
  }

  /** Returns a block for the given members, or null when every member is absent. */
  public static Validation ofNullable(
      BigDecimal min, BigDecimal max, String pattern, List<String> allowedTypes) {
    if (min == null && max == null && pattern == null && allowedTypes == null) {
      return null;
    }
    return new Validation(min, max, pattern, allowedTypes);
  }
}
