package io.applyflow.forms.formdefinition;

import java.math.BigDecimal;
import java.util.List;

/** Upload limits of a file field. */
public record FileConstraints(
    List<String> allowedMimeTypes, BigDecimal maxFileSizeMB, BigDecimal maxFiles) {

  public FileConstraints {
    allowedMimeTypes = allowedMimeTypes == null ? null : List.copyOf(allowedMimeTypes);
  }

  /** Returns a block for the given members, or null when every member is absent. */
  public static FileConstraints ofNullable(
      List<String> allowedMimeTypes, BigDecimal maxFileSizeMB, BigDecimal maxFiles) {
    if (allowedMimeTypes == null && maxFileSizeMB == null && maxFiles == null) {
      return null;
    }
    return new FileConstraints(allowedMimeTypes, maxFileSizeMB, maxFiles);
  }
}
