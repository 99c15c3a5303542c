package io.applyflow.forms.schema;

import io.applyflow.forms.condition.FieldLogic;
import io.applyflow.forms.formdefinition.FieldOption;
import io.applyflow.forms.formdefinition.FileConstraints;
import io.applyflow.forms.formdefinition.FormField;
import io.applyflow.forms.formdefinition.Validation;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes a {@link FormField} as {@code {id, key, type, label, validation?, ui?, logic?}}. Empty
 * blocks and empty members are left out rather than written as null or empty values.
 */
public final class FieldSchemaSerializer {

  private FieldSchemaSerializer() {}

  public static Map<String, Object> serialize(FormField field) {
    var out = new LinkedHashMap<String, Object>();
    out.put("id", field.fieldId());
    out.put("key", field.effectiveKey());
    out.put("type", field.type().getSchemaToken());
    out.put("label", field.label());

    var validation = serializeValidation(field);
    if (!validation.isEmpty()) {
      out.put("validation", validation);
    }
    var ui = serializeUi(field);
    if (!ui.isEmpty()) {
      out.put("ui", ui);
    }
    if (field.logic() != null) {
      out.put("logic", serializeLogic(field.logic()));
    }
    return out;
  }

  private static Map<String, Object> serializeValidation(FormField field) {
    var out = new LinkedHashMap<String, Object>();
    if (field.required()) {
      out.put("required", true);
    }
    Validation validation = field.validation();
    FileConstraints file = field.file();
    if (validation != null) {
      putIfPresent(out, "min", validation.min());
      putIfPresent(out, "max", validation.max());
      if (validation.pattern() != null && !validation.pattern().isEmpty()) {
        out.put("pattern", validation.pattern());
      }
    }
    var allowedTypes =
        RawValues.mergeDistinct(
            validation != null ? validation.allowedTypes() : null,
            file != null ? file.allowedMimeTypes() : null);
    if (!allowedTypes.isEmpty()) {
      out.put("allowedTypes", allowedTypes);
    }
    return out;
  }

  private static Map<String, Object> serializeUi(FormField field) {
    var out = new LinkedHashMap<String, Object>();
    if (field.placeholder() != null && !field.placeholder().isEmpty()) {
      out.put("placeholder", field.placeholder());
    }
    if (field.description() != null && !field.description().isEmpty()) {
      out.put("description", field.description());
    }
    if (!field.options().isEmpty()) {
      out.put(
          "options",
          field.options().stream()
              .map(FieldSchemaSerializer::serializeOption)
              .toList());
    }
    var file = field.file();
    if (file != null) {
      List<String> mimeTypes = file.allowedMimeTypes();
      if (mimeTypes != null && !mimeTypes.isEmpty()) {
        out.put("allowedMimeTypes", mimeTypes);
      }
      putIfPresent(out, "maxFileSizeMB", file.maxFileSizeMB());
      putIfPresent(out, "maxFiles", file.maxFiles());
    }
    return out;
  }

  private static Map<String, Object> serializeOption(FieldOption option) {
    var out = new LinkedHashMap<String, Object>();
    out.put("label", option.label());
    out.put("value", option.value());
    return out;
  }

  private static Map<String, Object> serializeLogic(FieldLogic logic) {
    var out = new LinkedHashMap<String, Object>();
    if (logic.showWhen() != null) {
      out.put("showWhen", ConditionGroupSerializer.serialize(logic.showWhen()));
    }
    if (logic.requireWhen() != null) {
      out.put("requireWhen", ConditionGroupSerializer.serialize(logic.requireWhen()));
    }
    return out;
  }

  private static void putIfPresent(Map<String, Object> out, String name, Object value) {
    if (value != null) {
      out.put(name, value);
    }
  }
}
