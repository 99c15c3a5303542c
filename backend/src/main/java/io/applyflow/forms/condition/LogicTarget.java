package io.applyflow.forms.condition;

/** The two condition groups a field can carry. */
public enum LogicTarget {
  SHOW_WHEN("showWhen"),
  REQUIRE_WHEN("requireWhen");

  private final String schemaKey;

  LogicTarget(String schemaKey) {
    this.schemaKey = schemaKey;
  }

  public String getSchemaKey() {
    return schemaKey;
  }
}
