package io.applyflow.forms.editor;

/** A structural problem in a form's conditional logic or keys. */
public record LogicViolation(String fieldId, String fieldKey, Code code, String message) {

  public enum Code {
    /** A rule points at a key no other field carries. */
    UNKNOWN_FIELD_KEY,
    /** A rule points at its own field. */
    SELF_REFERENCE,
    /** A rule's operator compares against a value but none is set. */
    MISSING_VALUE,
    /** Two or more fields share a key. */
    DUPLICATE_KEY
  }
}
