package io.applyflow.forms.formdefinition;

/** Supported question types. Each type knows the token it is persisted under. */
public enum FieldType {
  TEXT("text"),
  TEXTAREA("textarea"),
  EMAIL("email"),
  PHONE("phone"),
  NUMBER("number"),
  SELECT("select"),
  MULTISELECT("multiselect"),
  CHECKBOX("checkbox"),
  DATE("date"),
  FILE("file_upload"),
  INFO_TEXT("info_text");

  private final String schemaToken;

  FieldType(String schemaToken) {
    this.schemaToken = schemaToken;
  }

  public String getSchemaToken() {
    return schemaToken;
  }

  /** Returns true for the types that render a list of options. */
  public boolean hasOptions() {
    return this == SELECT || this == MULTISELECT;
  }
}
