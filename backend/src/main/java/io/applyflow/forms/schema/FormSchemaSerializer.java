package io.applyflow.forms.schema;

import io.applyflow.forms.formdefinition.FormDefinition;
import io.applyflow.forms.formdefinition.FormSection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Writes sections as the canonical {@code {sections: [...]}} schema document. */
public final class FormSchemaSerializer {

  private FormSchemaSerializer() {}

  public static Map<String, Object> serialize(FormDefinition form) {
    return serialize(form.sections());
  }

  public static Map<String, Object> serialize(List<FormSection> sections) {
    var out = new LinkedHashMap<String, Object>();
    out.put("sections", sections.stream().map(FormSchemaSerializer::serializeSection).toList());
    return out;
  }

  static Map<String, Object> serializeSection(FormSection section) {
    var out = new LinkedHashMap<String, Object>();
    out.put("id", section.id());
    out.put("title", section.title());
    if (section.description() != null && !section.description().isEmpty()) {
      out.put("description", section.description());
    }
    out.put("fields", section.fields().stream().map(FieldSchemaSerializer::serialize).toList());
    return out;
  }
}
