package io.applyflow.forms.editor;

import io.applyflow.forms.formdefinition.FieldOption;
import java.util.List;
import java.util.Locale;

/**
 * Turns pasted text into select options, one per non-blank line. The label is the trimmed line;
 * the value is the label lower-cased with whitespace runs replaced by {@code _} and anything
 * outside {@code [a-z0-9_-]} removed.
 */
public final class BulkOptionParser {

  private BulkOptionParser() {}

  public static List<FieldOption> parse(String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    return text.lines()
        .map(String::trim)
        .filter(line -> !line.isEmpty())
        .map(line -> new FieldOption(line, toValue(line)))
        .toList();
  }

  static String toValue(String label) {
    return label
        .toLowerCase(Locale.ROOT)
        .replaceAll("\\s+", "_")
        .replaceAll("[^a-z0-9_-]", "");
  }
}
