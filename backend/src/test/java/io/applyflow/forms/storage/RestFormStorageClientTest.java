package io.applyflow.forms.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withResourceNotFound;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestClient;

class RestFormStorageClientTest {

  private static final String BASE_URL = "http://storage.test/api";

  private MockRestServiceServer server;
  private RestFormStorageClient client;

  @BeforeEach
  void setUp() {
    var builder = RestClient.builder().baseUrl(BASE_URL);
    server = MockRestServiceServer.bindTo(builder).build();
    client = new RestFormStorageClient(builder.build());
  }

  @Test
  void listFormsAcceptsEnvelope() {
    server
        .expect(requestTo(BASE_URL + "/events/ev1/forms"))
        .andExpect(method(HttpMethod.GET))
        .andRespond(
            withSuccess(
                "{\"data\": [{\"id\": \"f1\"}, {\"id\": \"f2\"}, 7]}",
                MediaType.APPLICATION_JSON));

    var forms = client.listForms("ev1");

    assertThat(forms).extracting(form -> form.get("id")).containsExactly("f1", "f2");
    server.verify();
  }

  @Test
  void listVersionsAcceptsBareArray() {
    server
        .expect(requestTo(BASE_URL + "/events/ev1/forms/f1/versions"))
        .andRespond(
            withSuccess("[{\"id\": \"v1\", \"versionNumber\": 1}]", MediaType.APPLICATION_JSON));

    assertThat(client.listVersions("ev1", "f1")).hasSize(1);
    server.verify();
  }

  @Test
  void fetchFormUnwrapsRecord() {
    server
        .expect(requestTo(BASE_URL + "/events/ev1/forms/f1"))
        .andRespond(
            withSuccess(
                "{\"data\": {\"id\": \"f1\", \"name\": \"Signup\"}}", MediaType.APPLICATION_JSON));

    assertThat(client.fetchForm("ev1", "f1"))
        .hasValueSatisfying(record -> assertThat(record).containsEntry("name", "Signup"));
  }

  @Test
  void fetchFormMapsNotFoundToEmpty() {
    server
        .expect(requestTo(BASE_URL + "/events/ev1/forms/missing"))
        .andRespond(withResourceNotFound());

    assertThat(client.fetchForm("ev1", "missing")).isEmpty();
  }

  @Test
  void fetchFormPropagatesServerErrors() {
    server.expect(requestTo(BASE_URL + "/events/ev1/forms/f1")).andRespond(withServerError());

    assertThatThrownBy(() -> client.fetchForm("ev1", "f1"))
        .isInstanceOf(HttpServerErrorException.class);
  }

  @Test
  void createFormPostsName() {
    server
        .expect(requestTo(BASE_URL + "/events/ev1/forms"))
        .andExpect(method(HttpMethod.POST))
        .andExpect(content().json("{\"name\": \"Untitled Form\"}"))
        .andRespond(
            withSuccess(
                "{\"id\": \"f9\", \"name\": \"Untitled Form\"}", MediaType.APPLICATION_JSON));

    var record = client.createForm("ev1", "Untitled Form");

    assertThat(record).containsEntry("id", "f9");
    server.verify();
  }

  @Test
  void updateFormPatchesDraftSchema() {
    server
        .expect(requestTo(BASE_URL + "/events/ev1/forms/f1"))
        .andExpect(method(HttpMethod.PATCH))
        .andExpect(
            content()
                .json(
                    """
                    {"name": "Signup", "draftSchema": {"sections": []}, "draftUi": {}}
                    """))
        .andRespond(withSuccess());

    client.updateForm("ev1", "f1", "Signup", Map.of("sections", List.of()));

    server.verify();
  }

  @Test
  void publishWithoutRecordFails() {
    server
        .expect(requestTo(BASE_URL + "/events/ev1/forms/f1/publish"))
        .andExpect(method(HttpMethod.POST))
        .andRespond(withSuccess());

    assertThatThrownBy(() -> client.publishForm("ev1", "f1"))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("publish form");
  }

  @Test
  void deletesUseTheirOwnPaths() {
    server
        .expect(requestTo(BASE_URL + "/events/ev1/forms/f1/versions/v2"))
        .andExpect(method(HttpMethod.DELETE))
        .andRespond(withSuccess());
    server
        .expect(requestTo(BASE_URL + "/events/ev1/forms/f1"))
        .andExpect(method(HttpMethod.DELETE))
        .andRespond(withSuccess());

    client.deleteVersion("ev1", "f1", "v2");
    client.deleteForm("ev1", "f1");

    server.verify();
  }

  @Test
  void unwrapsOnlyObjectEnvelopes() {
    assertThat(RestFormStorageClient.unwrapRecord(Map.of("data", Map.of("id", "a"))))
        .containsEntry("id", "a");
    assertThat(RestFormStorageClient.unwrapRecord(Map.of("data", List.of(), "id", "b")))
        .containsEntry("id", "b");
    assertThat(RestFormStorageClient.unwrapRecord("nope")).isNull();
    assertThat(RestFormStorageClient.recordList(Map.of("data", "nope"))).isEmpty();
    assertThat(RestFormStorageClient.recordList(null)).isEmpty();
  }
}
