package io.applyflow.forms.storage;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The storage service that keeps form definitions and their published versions, keyed by event
 * and form id. Records are exchanged as raw JSON objects: form records carry the draft schema under
 * {@code draftSchema}, in whatever shape it was stored.
 */
public interface FormStorageClient {

  List<Map<String, Object>> listForms(String eventId);

  Optional<Map<String, Object>> fetchForm(String eventId, String formId);

  /** Creates an empty form and returns its record. */
  Map<String, Object> createForm(String eventId, String name);

  /** Replaces the draft of a form with the given canonical schema document. */
  void updateForm(String eventId, String formId, String name, Map<String, Object> draftSchema);

  /** Freezes the current draft as a new version and returns the version record. */
  Map<String, Object> publishForm(String eventId, String formId);

  List<Map<String, Object>> listVersions(String eventId, String formId);

  void deleteForm(String eventId, String formId);

  void deleteVersion(String eventId, String formId, String versionId);
}
