package io.applyflow.forms.formdefinition;

import io.applyflow.forms.config.FormsProperties;
import io.applyflow.forms.editor.FormLogicValidator;
import io.applyflow.forms.exception.InvalidStateException;
import io.applyflow.forms.exception.ResourceNotFoundException;
import io.applyflow.forms.schema.FormRecordParser;
import io.applyflow.forms.schema.FormSchemaJson;
import io.applyflow.forms.schema.FormSchemaSerializer;
import io.applyflow.forms.storage.FormStorageClient;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Loads form definitions from the storage service into the canonical model and saves them back in
 * the canonical persisted shape.
 */
@Service
public class FormDefinitionService {

  private static final Logger log = LoggerFactory.getLogger(FormDefinitionService.class);

  private final FormStorageClient storageClient;
  private final FormSchemaJson formSchemaJson;
  private final FormsProperties formsProperties;

  public FormDefinitionService(
      FormStorageClient storageClient,
      FormSchemaJson formSchemaJson,
      FormsProperties formsProperties) {
    this.storageClient = storageClient;
    this.formSchemaJson = formSchemaJson;
    this.formsProperties = formsProperties;
  }

  public List<FormSummary> listForms(String eventId) {
    return storageClient.listForms(eventId).stream().map(FormRecordParser::parseSummary).toList();
  }

  public FormWorkspace openForm(String eventId, String formId) {
    var form =
        storageClient
            .fetchForm(eventId, formId)
            .map(FormRecordParser::parseDefinition)
            .orElseThrow(() -> new ResourceNotFoundException("Form", formId));
    return new FormWorkspace(form, listVersions(eventId, formId));
  }

  public FormDefinition createForm(String eventId) {
    var record = storageClient.createForm(eventId, formsProperties.defaults().formTitle());
    var form = FormRecordParser.parseDefinition(record);
    log.info("Created form: eventId={}, formId={}", eventId, form.id());
    return form;
  }

  /**
   * Saves the form as a draft. The form is checked by {@link FormLogicValidator} first and
   * rejected with every violation listed when the check fails.
   */
  public void saveDraft(String eventId, FormDefinition form) {
    var violations = FormLogicValidator.validate(form);
    if (!violations.isEmpty()) {
      log.warn(
          "Rejected draft save: eventId={}, formId={}, violations={}",
          eventId,
          form.id(),
          violations.size());
      throw new InvalidStateException(
          "Invalid form logic",
          violations.size() + " problem(s) must be fixed before saving",
          violations.stream()
              .map(v -> v.fieldKey() + ": " + v.message() + " [" + v.code() + "]")
              .toList());
    }
    storageClient.updateForm(
        eventId, form.id(), form.title(), FormSchemaSerializer.serialize(form));
    log.info(
        "Saved form draft: eventId={}, formId={}, sections={}, fields={}",
        eventId,
        form.id(),
        form.sections().size(),
        form.fieldCount());
  }

  public FormVersion publish(String eventId, String formId) {
    var version = FormRecordParser.parseVersion(storageClient.publishForm(eventId, formId));
    log.info(
        "Published form: eventId={}, formId={}, version={}",
        eventId,
        formId,
        version.versionNumber());
    return version;
  }

  public List<FormVersion> listVersions(String eventId, String formId) {
    return storageClient.listVersions(eventId, formId).stream()
        .map(FormRecordParser::parseVersion)
        .sorted(Comparator.comparingInt(FormVersion::versionNumber).reversed())
        .toList();
  }

  public void deleteForm(String eventId, String formId) {
    storageClient.deleteForm(eventId, formId);
    log.info("Deleted form: eventId={}, formId={}", eventId, formId);
  }

  /** Deletes one version and returns the form's status once it is gone. */
  public FormStatus deleteVersion(String eventId, String formId, String versionId) {
    storageClient.deleteVersion(eventId, formId, versionId);
    var remaining = storageClient.listVersions(eventId, formId).size();
    var status = FormStatus.afterVersionDeleted(remaining);
    log.info(
        "Deleted form version: eventId={}, formId={}, versionId={}, status={}",
        eventId,
        formId,
        versionId,
        status);
    return status;
  }

  /** The canonical schema document of a form as JSON text. */
  public String exportSchema(FormDefinition form) {
    return formSchemaJson.write(form.sections());
  }

  /** Replaces the sections of a form with those of a schema document given as JSON text. */
  public FormDefinition importSchema(FormDefinition form, String json) {
    var sections = formSchemaJson.readSections(json);
    log.info("Imported schema: formId={}, sections={}", form.id(), sections.size());
    return form.withSections(sections);
  }
}
