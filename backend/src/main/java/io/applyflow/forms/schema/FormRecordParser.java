package io.applyflow.forms.schema;

import io.applyflow.forms.formdefinition.FormDefinition;
import io.applyflow.forms.formdefinition.FormSummary;
import io.applyflow.forms.formdefinition.FormVersion;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * Reads the form and version records returned by the storage service. The draft schema of a form
 * record lives under {@code draftSchema}; the title under {@code title} or {@code name}. Version
 * records may use camelCase or snake_case member names.
 */
public final class FormRecordParser {

  static final String DEFAULT_FORM_TITLE = "Untitled Form";

  private FormRecordParser() {}

  public static FormDefinition parseDefinition(Map<String, Object> record) {
    var raw = RawValues.asObject(record);
    return new FormDefinition(
        idOf(raw),
        titleOf(raw),
        FormStatusDeriver.derive(raw),
        FormSchemaParser.parseSections(raw.get("draftSchema")));
  }

  public static FormSummary parseSummary(Map<String, Object> record) {
    var form = parseDefinition(record);
    return new FormSummary(
        form.id(),
        form.title(),
        form.status(),
        form.sections().size(),
        form.fieldCount(),
        instantOrNow(RawValues.asObject(record).get("updatedAt")));
  }

  public static FormVersion parseVersion(Map<String, Object> record) {
    var raw = RawValues.asObject(record);
    var versionNumber =
        RawValues.firstDecimal(raw.get("versionNumber"), raw.get("version_number"));
    return new FormVersion(
        idOf(raw),
        versionNumber != null ? versionNumber.intValue() : 0,
        instantOrNow(RawValues.firstPresent(raw.get("publishedAt"), raw.get("published_at"))),
        RawValues.stringOr(null, raw.get("publishedBy"), raw.get("published_by")));
  }

  private static String idOf(Map<String, Object> raw) {
    var id = RawValues.text(raw.get("id"));
    return id != null ? id : "";
  }

  private static String titleOf(Map<String, Object> raw) {
    var title = RawValues.text(RawValues.firstPresent(raw.get("title"), raw.get("name")));
    return title != null ? title : DEFAULT_FORM_TITLE;
  }

  private static Instant instantOrNow(Object raw) {
    if (raw instanceof String str && !str.isBlank()) {
      try {
        return Instant.parse(str.trim());
      } catch (DateTimeParseException e) {
        return Instant.now();
      }
    }
    return Instant.now();
  }
}
