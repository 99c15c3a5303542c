package io.applyflow.forms.formdefinition;

/** Publication state of a form. */
public enum FormStatus {
  DRAFT,
  PUBLISHED;

  /** Status after a version is deleted: published while any version remains. */
  public static FormStatus afterVersionDeleted(int remainingVersions) {
    return remainingVersions > 0 ? PUBLISHED : DRAFT;
  }
}
