package io.applyflow.forms.schema;

import io.applyflow.forms.condition.FieldLogic;
import io.applyflow.forms.formdefinition.FieldOption;
import io.applyflow.forms.formdefinition.FieldType;
import io.applyflow.forms.formdefinition.FileConstraints;
import io.applyflow.forms.formdefinition.FormField;
import io.applyflow.forms.formdefinition.FormIds;
import io.applyflow.forms.formdefinition.Validation;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link FormField} from one persisted field.
 *
 * <p>Each member is looked up in its current location first ({@code validation}, {@code ui},
 * {@code logic}) and then as a flat top-level member, the shape older drafts were stored in.
 * Missing or malformed members fall back to defaults; parsing never fails.
 */
public final class FieldSchemaParser {

  private static final Logger log = LoggerFactory.getLogger(FieldSchemaParser.class);

  static final String DEFAULT_LABEL = "Field";

  private static final Map<String, FieldType> TYPES_BY_TOKEN = buildTypeTable();

  private FieldSchemaParser() {}

  public static FormField parse(Object rawField) {
    var field = RawValues.asObject(rawField);
    var rawValidation = RawValues.asObject(field.get("validation"));
    var rawUi = RawValues.asObject(field.get("ui"));
    var rawLogic = RawValues.asObject(field.get("logic"));

    var rawId = RawValues.text(field.get("id"));
    String fieldId = rawId != null ? rawId : FormIds.newFieldId();
    var rawKey = RawValues.nonEmptyString(field.get("key"));
    String key = rawKey != null ? rawKey : fieldId;

    var validation = parseValidation(rawValidation, field);
    var allowedTypes = validation != null ? validation.allowedTypes() : null;

    return new FormField(
        fieldId,
        key,
        parseType(field.get("type")),
        parseLabel(field.get("label")),
        RawValues.flag(
            RawValues.firstPresent(rawValidation.get("required"), field.get("required"))),
        RawValues.stringOr(null, rawUi.get("placeholder"), field.get("placeholder")),
        RawValues.stringOr(null, rawUi.get("description"), field.get("description")),
        parseOptions(RawValues.firstPresent(rawUi.get("options"), field.get("options"))),
        validation,
        parseFile(rawUi, allowedTypes),
        FieldLogic.ofNullable(
            ConditionGroupParser.parse(
                RawValues.firstPresent(rawLogic.get("showWhen"), field.get("showWhen"))),
            ConditionGroupParser.parse(
                RawValues.firstPresent(rawLogic.get("requireWhen"), field.get("requireWhen")))));
  }

  /** Resolves a persisted type token; unknown or missing tokens read as short text. */
  public static FieldType parseType(Object rawType) {
    if (rawType == null) {
      return FieldType.TEXT;
    }
    var token = rawType.toString().trim().toLowerCase(Locale.ROOT);
    var type = TYPES_BY_TOKEN.get(token);
    if (type == null) {
      log.debug("Unknown field type token '{}', reading as {}", token, FieldType.TEXT);
      return FieldType.TEXT;
    }
    return type;
  }

  private static String parseLabel(Object rawLabel) {
    var label = RawValues.text(rawLabel);
    return label != null ? label : DEFAULT_LABEL;
  }

  private static Validation parseValidation(
      Map<String, Object> rawValidation, Map<String, Object> field) {
    return Validation.ofNullable(
        RawValues.firstDecimal(rawValidation.get("min"), field.get("min")),
        RawValues.firstDecimal(rawValidation.get("max"), field.get("max")),
        RawValues.stringOr(null, rawValidation.get("pattern"), field.get("pattern")),
        RawValues.firstStringList(rawValidation.get("allowedTypes"), field.get("allowedTypes")));
  }

  // the MIME list and validation allowedTypes are one set of accepted types seen from two places
  private static FileConstraints parseFile(Map<String, Object> rawUi, List<String> allowedTypes) {
    var allowedMimeTypes = RawValues.stringList(rawUi.get("allowedMimeTypes"));
    return FileConstraints.ofNullable(
        allowedMimeTypes != null ? allowedMimeTypes : allowedTypes,
        RawValues.decimal(rawUi.get("maxFileSizeMB")),
        RawValues.decimal(rawUi.get("maxFiles")));
  }

  private static List<FieldOption> parseOptions(Object rawOptions) {
    var list = RawValues.asList(rawOptions);
    if (list == null) {
      return List.of();
    }
    var options = new ArrayList<FieldOption>();
    for (Object entry : list) {
      var option = RawValues.asObject(entry);
      if (option.get("label") instanceof String label
          && option.get("value") instanceof String value) {
        options.add(new FieldOption(label, value));
      }
    }
    return options;
  }

  private static Map<String, FieldType> buildTypeTable() {
    var table = new HashMap<String, FieldType>();
    for (var type : FieldType.values()) {
      table.put(type.getSchemaToken(), type);
    }
    table.put("multi_select", FieldType.MULTISELECT);
    table.put("file", FieldType.FILE);
    return Map.copyOf(table);
  }
}
