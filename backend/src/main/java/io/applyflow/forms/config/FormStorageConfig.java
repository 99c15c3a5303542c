package io.applyflow.forms.config;

import io.applyflow.forms.storage.FormStorageClient;
import io.applyflow.forms.storage.RestFormStorageClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

@Configuration
public class FormStorageConfig {

  private static final Logger log = LoggerFactory.getLogger(FormStorageConfig.class);

  @Bean
  public RestClient formStorageRestClient(FormsProperties properties) {
    var baseUrl = properties.storage().baseUrl();
    log.info("Form storage client configured: baseUrl={}", baseUrl);
    return RestClient.builder()
        .baseUrl(baseUrl)
        .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
        .build();
  }

  @Bean
  public FormStorageClient formStorageClient(RestClient formStorageRestClient) {
    return new RestFormStorageClient(formStorageRestClient);
  }
}
