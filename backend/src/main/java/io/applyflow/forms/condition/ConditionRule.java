package io.applyflow.forms.condition;

import java.util.Objects;

/**
 * A single comparison against another field's answer. {@code value} is always null for operators
 * that take no value; it may also be null for value-requiring operators read from legacy data.
 */
public record ConditionRule(String fieldKey, ConditionOperator operator, String value) {

  public ConditionRule {
    Objects.requireNonNull(fieldKey, "fieldKey");
    Objects.requireNonNull(operator, "operator");
    if (!operator.requiresValue()) {
      value = null;
    }
  }

  public static ConditionRule presence(String fieldKey, ConditionOperator operator) {
    return new ConditionRule(fieldKey, operator, null);
  }

  public boolean hasValue() {
    return value != null;
  }

  public ConditionRule withFieldKey(String newFieldKey) {
    return new ConditionRule(newFieldKey, operator, value);
  }

  public ConditionRule withValue(String newValue) {
    return new ConditionRule(fieldKey, operator, newValue);
  }

  /**
   * Switches the operator. Presence operators drop the value; value operators keep the current
   * value or start from an empty string.
   */
  public ConditionRule withOperator(ConditionOperator newOperator) {
    String nextValue = newOperator.requiresValue() ? (value != null ? value : "") : null;
    return new ConditionRule(fieldKey, newOperator, nextValue);
  }
}
