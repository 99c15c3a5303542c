package io.applyflow.forms.formdefinition;

import java.util.UUID;

/** Generates ids for sections and fields that arrive without one. */
public final class FormIds {

  static final String FIELD_PREFIX = "field_";
  static final String SECTION_PREFIX = "sec_";

  private FormIds() {}

  public static String newFieldId() {
    return FIELD_PREFIX + shortUuid();
  }

  public static String newSectionId() {
    return SECTION_PREFIX + shortUuid();
  }

  private static String shortUuid() {
    return UUID.randomUUID().toString().replace("-", "").substring(0, 12);
  }
}
