package io.applyflow.forms.schema;

import io.applyflow.forms.condition.ConditionGroup;
import io.applyflow.forms.condition.ConditionMode;
import io.applyflow.forms.condition.ConditionOperatorNormalizer;
import io.applyflow.forms.condition.ConditionRule;
import java.util.ArrayList;
import java.util.Map;

/**
 * Builds a {@link ConditionGroup} from a persisted group in any of its historical shapes.
 *
 * <p>Rules are read from {@code rules} or the legacy {@code conditions}; a rule's field key from
 * {@code fieldKey} or the legacy {@code key}. Rules without a usable key are dropped. A group left
 * without rules is dropped as a whole.
 */
public final class ConditionGroupParser {

  private ConditionGroupParser() {}

  /** Returns the parsed group, or null when the input holds no usable rule. */
  public static ConditionGroup parse(Object raw) {
    if (!RawValues.isObject(raw)) {
      return null;
    }
    var group = RawValues.asObject(raw);
    var rawRules = RawValues.asList(group.get("rules"));
    if (rawRules == null) {
      rawRules = RawValues.asList(group.get("conditions"));
    }
    if (rawRules == null) {
      return null;
    }

    var rules = new ArrayList<ConditionRule>();
    for (Object rawRule : rawRules) {
      if (RawValues.isObject(rawRule)) {
        var rule = parseRule(RawValues.asObject(rawRule));
        if (rule != null) {
          rules.add(rule);
        }
      }
    }
    return ConditionGroup.ofNullable(ConditionMode.from(group.get("mode")), rules);
  }

  private static ConditionRule parseRule(Map<String, Object> rule) {
    var fieldKey = RawValues.stringOr(null, rule.get("fieldKey"), rule.get("key"));
    if (fieldKey == null || fieldKey.isBlank()) {
      return null;
    }
    return new ConditionRule(
        fieldKey.trim(),
        ConditionOperatorNormalizer.normalize(rule.get("operator")),
        RawValues.text(rule.get("value")));
  }
}
