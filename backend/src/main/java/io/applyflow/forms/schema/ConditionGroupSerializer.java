package io.applyflow.forms.schema;

import io.applyflow.forms.condition.ConditionGroup;
import io.applyflow.forms.condition.ConditionRule;
import java.util.LinkedHashMap;
import java.util.Map;

/** Writes a {@link ConditionGroup} in the canonical persisted shape. */
public final class ConditionGroupSerializer {

  private ConditionGroupSerializer() {}

  public static Map<String, Object> serialize(ConditionGroup group) {
    var out = new LinkedHashMap<String, Object>();
    out.put("mode", group.mode().getToken());
    out.put("rules", group.rules().stream().map(ConditionGroupSerializer::serializeRule).toList());
    return out;
  }

  static Map<String, Object> serializeRule(ConditionRule rule) {
    var out = new LinkedHashMap<String, Object>();
    out.put("fieldKey", rule.fieldKey());
    out.put("operator", rule.operator().getToken());
    if (rule.hasValue() && rule.operator().requiresValue()) {
      out.put("value", rule.value());
    }
    return out;
  }
}
