package io.applyflow.forms.formdefinition;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/** A form as the editor and renderer see it: ordered sections of ordered fields. */
public record FormDefinition(
    String id, String title, FormStatus status, List<FormSection> sections) {

  public FormDefinition {
    id = id == null ? "" : id;
    title = title == null ? "" : title;
    Objects.requireNonNull(status, "status");
    sections = sections == null ? List.of() : List.copyOf(sections);
  }

  /** Every field of every section, in presentation order. */
  public Stream<FormField> fields() {
    return sections.stream().flatMap(section -> section.fields().stream());
  }

  public int fieldCount() {
    return sections.stream().mapToInt(section -> section.fields().size()).sum();
  }

  public Optional<FormField> findField(String fieldId) {
    return fields().filter(field -> field.fieldId().equals(fieldId)).findFirst();
  }

  public Optional<FormSection> findSection(String sectionId) {
    return sections.stream().filter(section -> section.id().equals(sectionId)).findFirst();
  }

  public FormDefinition withSections(List<FormSection> newSections) {
    return new FormDefinition(id, title, status, newSections);
  }
}
