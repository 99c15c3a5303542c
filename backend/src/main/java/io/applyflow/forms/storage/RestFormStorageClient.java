package io.applyflow.forms.storage;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;

/**
 * {@link FormStorageClient} over the storage service's REST API. Responses may arrive bare or
 * wrapped in a {@code {"data": ...}} envelope; both are accepted.
 */
public class RestFormStorageClient implements FormStorageClient {

  private static final Logger log = LoggerFactory.getLogger(RestFormStorageClient.class);

  private static final ParameterizedTypeReference<Object> ANY_JSON =
      new ParameterizedTypeReference<>() {};

  private final RestClient restClient;

  public RestFormStorageClient(RestClient restClient) {
    this.restClient = restClient;
  }

  @Override
  public List<Map<String, Object>> listForms(String eventId) {
    var body = restClient.get().uri("/events/{eventId}/forms", eventId).retrieve().body(ANY_JSON);
    return recordList(body);
  }

  @Override
  public Optional<Map<String, Object>> fetchForm(String eventId, String formId) {
    try {
      var body =
          restClient
              .get()
              .uri("/events/{eventId}/forms/{formId}", eventId, formId)
              .retrieve()
              .body(ANY_JSON);
      return Optional.ofNullable(unwrapRecord(body));
    } catch (HttpClientErrorException ex) {
      if (ex.getStatusCode().isSameCodeAs(HttpStatus.NOT_FOUND)) {
        log.debug("Form not found in storage: eventId={}, formId={}", eventId, formId);
        return Optional.empty();
      }
      throw ex;
    }
  }

  @Override
  public Map<String, Object> createForm(String eventId, String name) {
    var body =
        restClient
            .post()
            .uri("/events/{eventId}/forms", eventId)
            .contentType(MediaType.APPLICATION_JSON)
            .body(Map.of("name", name))
            .retrieve()
            .body(ANY_JSON);
    return requireRecord(body, "create form");
  }

  @Override
  public void updateForm(
      String eventId, String formId, String name, Map<String, Object> draftSchema) {
    var payload = new LinkedHashMap<String, Object>();
    payload.put("name", name);
    payload.put("draftSchema", draftSchema);
    payload.put("draftUi", Map.of());
    restClient
        .patch()
        .uri("/events/{eventId}/forms/{formId}", eventId, formId)
        .contentType(MediaType.APPLICATION_JSON)
        .body(payload)
        .retrieve()
        .toBodilessEntity();
  }

  @Override
  public Map<String, Object> publishForm(String eventId, String formId) {
    var body =
        restClient
            .post()
            .uri("/events/{eventId}/forms/{formId}/publish", eventId, formId)
            .retrieve()
            .body(ANY_JSON);
    return requireRecord(body, "publish form");
  }

  @Override
  public List<Map<String, Object>> listVersions(String eventId, String formId) {
    var body =
        restClient
            .get()
            .uri("/events/{eventId}/forms/{formId}/versions", eventId, formId)
            .retrieve()
            .body(ANY_JSON);
    return recordList(body);
  }

  @Override
  public void deleteForm(String eventId, String formId) {
    restClient
        .delete()
        .uri("/events/{eventId}/forms/{formId}", eventId, formId)
        .retrieve()
        .toBodilessEntity();
  }

  @Override
  public void deleteVersion(String eventId, String formId, String versionId) {
    restClient
        .delete()
        .uri(
            "/events/{eventId}/forms/{formId}/versions/{versionId}", eventId, formId, versionId)
        .retrieve()
        .toBodilessEntity();
  }

  /** Unwraps a {@code data} envelope around a single record. */
  static Map<String, Object> unwrapRecord(Object body) {
    var map = asRecord(body);
    if (map == null) {
      return null;
    }
    var data = asRecord(map.get("data"));
    return data != null ? data : map;
  }

  /** Accepts a bare array or an array wrapped in {@code data}; anything else is empty. */
  static List<Map<String, Object>> recordList(Object body) {
    Object items = body;
    var map = asRecord(body);
    if (map != null) {
      items = map.get("data");
    }
    if (!(items instanceof List<?> list)) {
      return List.of();
    }
    return list.stream().map(RestFormStorageClient::asRecord).filter(r -> r != null).toList();
  }

  private static Map<String, Object> requireRecord(Object body, String operation) {
    var record = unwrapRecord(body);
    if (record == null) {
      log.warn("Storage service returned no record: operation={}", operation);
      throw new IllegalStateException("Storage service returned no record for " + operation);
    }
    return record;
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> asRecord(Object value) {
    return value instanceof Map<?, ?> map ? (Map<String, Object>) map : null;
  }
}
