package io.applyflow.forms.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for the form definition module.
 *
 * @param storage where form definitions and their versions are stored
 * @param defaults values applied to newly created forms
 */
@Validated
@ConfigurationProperties(prefix = "forms")
public record FormsProperties(@Valid @NotNull Storage storage, @Valid @NotNull Defaults defaults) {

  /**
   * @param baseUrl base URL of the storage API, e.g. {@code http://localhost:4000/api}
   */
  public record Storage(@NotBlank String baseUrl) {}

  /**
   * @param formTitle title given to a form created from the editor
   */
  public record Defaults(@NotBlank String formTitle) {}
}
