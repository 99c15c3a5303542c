package io.applyflow.forms.condition;

/** How the rules of a condition group combine. */
public enum ConditionMode {
  ALL("all"),
  ANY("any");

  private final String token;

  ConditionMode(String token) {
    this.token = token;
  }

  public String getToken() {
    return token;
  }

  /** Returns ANY when the raw value reads "any" in any casing, ALL otherwise. */
  public static ConditionMode from(Object value) {
    if (value instanceof String str && ANY.token.equalsIgnoreCase(str.trim())) {
      return ANY;
    }
    return ALL;
  }
}
