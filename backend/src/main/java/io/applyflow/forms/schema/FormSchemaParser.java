package io.applyflow.forms.schema;

import io.applyflow.forms.formdefinition.FormField;
import io.applyflow.forms.formdefinition.FormIds;
import io.applyflow.forms.formdefinition.FormSection;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the sections of a persisted schema document. Sections are taken from {@code sections}, or
 * from {@code pages} in legacy documents; a document with neither has no sections.
 */
public final class FormSchemaParser {

  static final String DEFAULT_SECTION_TITLE = "Untitled section";

  private FormSchemaParser() {}

  public static List<FormSection> parseSections(Object rawSchema) {
    var schema = RawValues.asObject(rawSchema);
    var rawSections = RawValues.asList(schema.get("sections"));
    if (rawSections == null) {
      rawSections = RawValues.asList(schema.get("pages"));
    }
    if (rawSections == null) {
      return List.of();
    }
    return rawSections.stream().map(FormSchemaParser::parseSection).toList();
  }

  public static FormSection parseSection(Object rawSection) {
    var section = RawValues.asObject(rawSection);
    var id = RawValues.text(section.get("id"));
    var title = RawValues.text(section.get("title"));
    var rawFields = RawValues.asList(section.get("fields"));

    var fields = new ArrayList<FormField>();
    if (rawFields != null) {
      for (Object rawField : rawFields) {
        fields.add(FieldSchemaParser.parse(rawField));
      }
    }
    return new FormSection(
        id != null ? id : FormIds.newSectionId(),
        title != null ? title : DEFAULT_SECTION_TITLE,
        RawValues.string(section.get("description")),
        fields);
  }
}
