package io.applyflow.forms.formdefinition;

import java.util.Objects;

/** One choice of a select or multi-select field. */
public record FieldOption(String label, String value) {

  public FieldOption {
    Objects.requireNonNull(label, "label");
    Objects.requireNonNull(value, "value");
  }
}
