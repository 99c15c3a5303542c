package io.applyflow.forms.formdefinition;

import java.util.List;

/** A form opened for editing together with its published versions, newest first. */
public record FormWorkspace(FormDefinition form, List<FormVersion> versions) {

  public FormWorkspace {
    versions = versions == null ? List.of() : List.copyOf(versions);
  }
}
