package io.applyflow.forms.schema;

import io.applyflow.forms.formdefinition.FormSection;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/** Reads and writes schema documents as JSON text. */
@Component
public class FormSchemaJson {

  private static final Logger log = LoggerFactory.getLogger(FormSchemaJson.class);

  private final ObjectMapper objectMapper;

  public FormSchemaJson(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /** Parses a schema document in any accepted shape. Text that is not JSON has no sections. */
  public List<FormSection> readSections(String json) {
    if (json == null || json.isBlank()) {
      return List.of();
    }
    Object raw;
    try {
      raw = objectMapper.readValue(json, Object.class);
    } catch (JacksonException e) {
      log.warn("Schema document is not valid JSON, reading it as empty: {}", e.getMessage());
      return List.of();
    }
    return FormSchemaParser.parseSections(raw);
  }

  /** Writes the canonical schema document for the given sections. */
  public String write(List<FormSection> sections) {
    return objectMapper.writeValueAsString(FormSchemaSerializer.serialize(sections));
  }
}
