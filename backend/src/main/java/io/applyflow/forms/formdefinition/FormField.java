package io.applyflow.forms.formdefinition;

import io.applyflow.forms.condition.FieldLogic;
import java.util.List;
import java.util.Objects;

/**
 * A question in a form section.
 *
 * <p>{@code fieldId} is assigned once and never changes. {@code key} is the user-editable name
 * that answers and other fields' rules refer to; a blank key stands for the field id (see {@link
 * #effectiveKey()}). {@code options} is empty when the field has none; {@code validation}, {@code
 * file} and {@code logic} are null when absent.
 */
public record FormField(
    String fieldId,
    String key,
    FieldType type,
    String label,
    boolean required,
    String placeholder,
    String description,
    List<FieldOption> options,
    Validation validation,
    FileConstraints file,
    FieldLogic logic) {

  public FormField {
    Objects.requireNonNull(fieldId, "fieldId");
    Objects.requireNonNull(type, "type");
    key = key == null ? fieldId : key;
    label = label == null ? "" : label;
    options = options == null ? List.of() : List.copyOf(options);
  }

  /** A short text field whose key equals its id. */
  public static FormField create(String fieldId, String label) {
    return new FormField(
        fieldId, fieldId, FieldType.TEXT, label, false, null, null, List.of(), null, null, null);
  }

  /** The trimmed key, or the field id when the key is blank. */
  public String effectiveKey() {
    return key.isBlank() ? fieldId : key.trim();
  }

  public FormField withKey(String newKey) {
    return new FormField(
        fieldId, newKey, type, label, required, placeholder, description, options, validation,
        file, logic);
  }

  public FormField withType(FieldType newType) {
    return new FormField(
        fieldId, key, newType, label, required, placeholder, description, options, validation,
        file, logic);
  }

  public FormField withLabel(String newLabel) {
    return new FormField(
        fieldId, key, type, newLabel, required, placeholder, description, options, validation,
        file, logic);
  }

  public FormField withRequired(boolean newRequired) {
    return new FormField(
        fieldId, key, type, label, newRequired, placeholder, description, options, validation,
        file, logic);
  }

  public FormField withPlaceholder(String newPlaceholder) {
    return new FormField(
        fieldId, key, type, label, required, newPlaceholder, description, options, validation,
        file, logic);
  }

  public FormField withDescription(String newDescription) {
    return new FormField(
        fieldId, key, type, label, required, placeholder, newDescription, options, validation,
        file, logic);
  }

  public FormField withOptions(List<FieldOption> newOptions) {
    return new FormField(
        fieldId, key, type, label, required, placeholder, description, newOptions, validation,
        file, logic);
  }

  public FormField withValidation(Validation newValidation) {
    return new FormField(
        fieldId, key, type, label, required, placeholder, description, options, newValidation,
        file, logic);
  }

  public FormField withFile(FileConstraints newFile) {
    return new FormField(
        fieldId, key, type, label, required, placeholder, description, options, validation,
        newFile, logic);
  }

  public FormField withLogic(FieldLogic newLogic) {
    return new FormField(
        fieldId, key, type, label, required, placeholder, description, options, validation, file,
        newLogic);
  }
}
