package io.applyflow.forms.editor;

/** A field that another field's rule may point at. */
public record LogicFieldOption(String key, String label) {}
