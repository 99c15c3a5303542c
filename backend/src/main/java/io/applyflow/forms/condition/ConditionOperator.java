package io.applyflow.forms.condition;

/** Comparison operators available to conditional-logic rules. */
public enum ConditionOperator {
  EQUALS("eq", true),
  NOT_EQUALS("neq", true),
  CONTAINS("contains", true),
  NOT_CONTAINS("not_contains", true),
  GREATER_THAN("gt", true),
  GREATER_OR_EQUAL("gte", true),
  LESS_THAN("lt", true),
  LESS_OR_EQUAL("lte", true),
  EXISTS("exists", false),
  NOT_EXISTS("not_exists", false),
  IN_LIST("in", true),
  NOT_IN_LIST("not_in", true);

  private final String token;
  private final boolean requiresValue;

  ConditionOperator(String token, boolean requiresValue) {
    this.token = token;
    this.requiresValue = requiresValue;
  }

  /** Token written to the persisted schema. */
  public String getToken() {
    return token;
  }

  /** Returns true unless the operator only tests for presence. */
  public boolean requiresValue() {
    return requiresValue;
  }
}
