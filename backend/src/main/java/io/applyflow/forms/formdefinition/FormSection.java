package io.applyflow.forms.formdefinition;

import java.util.List;
import java.util.Objects;

/** An ordered group of fields presented together. */
public record FormSection(String id, String title, String description, List<FormField> fields) {

  public FormSection {
    Objects.requireNonNull(id, "id");
    title = title == null ? "" : title;
    fields = fields == null ? List.of() : List.copyOf(fields);
  }

  public FormSection withTitle(String newTitle) {
    return new FormSection(id, newTitle, description, fields);
  }

  public FormSection withDescription(String newDescription) {
    return new FormSection(id, title, newDescription, fields);
  }

  public FormSection withFields(List<FormField> newFields) {
    return new FormSection(id, title, description, newFields);
  }
}
