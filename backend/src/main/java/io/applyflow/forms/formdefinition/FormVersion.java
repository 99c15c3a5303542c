package io.applyflow.forms.formdefinition;

import java.time.Instant;

/** A published, immutable snapshot of a form. {@code publishedBy} may be null. */
public record FormVersion(
    String id, int versionNumber, Instant publishedAt, String publishedBy) {}
