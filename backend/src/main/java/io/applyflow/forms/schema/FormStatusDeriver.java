package io.applyflow.forms.schema;

import io.applyflow.forms.formdefinition.FormStatus;
import java.util.Locale;
import java.util.Map;

/**
 * Derives DRAFT or PUBLISHED from a stored form record.
 *
 * <p>The stored {@code status} is not always kept in sync with publishing, so a positive {@code
 * latestVersion} counter also means PUBLISHED. Pure utility class with no Spring dependencies.
 */
public final class FormStatusDeriver {

  private FormStatusDeriver() {}

  public static FormStatus derive(Map<String, Object> record) {
    if (record == null) {
      return FormStatus.DRAFT;
    }
    var status = record.get("status");
    if (status instanceof String str
        && FormStatus.PUBLISHED.name().equals(str.trim().toUpperCase(Locale.ROOT))) {
      return FormStatus.PUBLISHED;
    }
    var latestVersion = RawValues.decimal(record.get("latestVersion"));
    return latestVersion != null && latestVersion.signum() > 0
        ? FormStatus.PUBLISHED
        : FormStatus.DRAFT;
  }
}
