package io.applyflow.forms.editor;

import io.applyflow.forms.condition.ConditionRule;
import io.applyflow.forms.formdefinition.FormDefinition;
import io.applyflow.forms.formdefinition.FormField;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

/**
 * Cross-field checks over a fully assembled form. The parser accepts any rule it can read; this
 * pass is where rules pointing at missing or own fields, missing comparison values and duplicate
 * keys are found. Pure utility class with no Spring dependencies.
 */
public final class FormLogicValidator {

  private FormLogicValidator() {}

  public static List<LogicViolation> validate(FormDefinition form) {
    var violations = new ArrayList<LogicViolation>();
    var fields = form.fields().toList();

    var fieldsByKey = new LinkedHashMap<String, List<FormField>>();
    for (var field : fields) {
      fieldsByKey.computeIfAbsent(field.effectiveKey(), k -> new ArrayList<>()).add(field);
    }
    fieldsByKey.forEach(
        (key, sharing) -> {
          if (sharing.size() > 1) {
            for (var field : sharing) {
              violations.add(
                  new LogicViolation(
                      field.fieldId(),
                      key,
                      LogicViolation.Code.DUPLICATE_KEY,
                      "Key '" + key + "' is used by " + sharing.size() + " fields"));
            }
          }
        });

    for (var field : fields) {
      if (field.logic() == null) {
        continue;
      }
      var otherKeys = keysExcluding(fields, field);
      for (ConditionRule rule : field.logic().allRules()) {
        checkRule(field, rule, otherKeys, violations);
      }
    }
    return violations;
  }

  public static boolean isValid(FormDefinition form) {
    return validate(form).isEmpty();
  }

  private static void checkRule(
      FormField field, ConditionRule rule, Set<String> otherKeys, List<LogicViolation> out) {
    if (rule.fieldKey().equals(field.effectiveKey())) {
      out.add(
          new LogicViolation(
              field.fieldId(),
              field.effectiveKey(),
              LogicViolation.Code.SELF_REFERENCE,
              "A field cannot depend on itself"));
    } else if (!otherKeys.contains(rule.fieldKey())) {
      out.add(
          new LogicViolation(
              field.fieldId(),
              field.effectiveKey(),
              LogicViolation.Code.UNKNOWN_FIELD_KEY,
              "Rule references unknown field key '" + rule.fieldKey() + "'"));
    }
    if (rule.operator().requiresValue() && !rule.hasValue()) {
      out.add(
          new LogicViolation(
              field.fieldId(),
              field.effectiveKey(),
              LogicViolation.Code.MISSING_VALUE,
              "Operator '" + rule.operator().getToken() + "' needs a value"));
    }
  }

  static Set<String> keysExcluding(List<FormField> fields, FormField excluded) {
    var keys = new HashSet<String>();
    for (var field : fields) {
      if (!field.fieldId().equals(excluded.fieldId())) {
        keys.add(field.effectiveKey());
      }
    }
    return keys;
  }
}
