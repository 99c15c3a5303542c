package io.applyflow.forms.formdefinition;

import java.time.Instant;

/** One row of the form list. */
public record FormSummary(
    String id,
    String title,
    FormStatus status,
    int sectionCount,
    int fieldCount,
    Instant updatedAt) {}
