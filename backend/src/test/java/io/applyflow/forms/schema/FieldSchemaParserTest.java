package io.applyflow.forms.schema;

import static org.assertj.core.api.Assertions.assertThat;

import io.applyflow.forms.condition.ConditionMode;
import io.applyflow.forms.condition.ConditionOperator;
import io.applyflow.forms.condition.ConditionRule;
import io.applyflow.forms.formdefinition.FieldOption;
import io.applyflow.forms.formdefinition.FieldType;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class FieldSchemaParserTest {

  @Test
  void readsCanonicalField() {
    var field =
        FieldSchemaParser.parse(
            SchemaFixtures.parseJson(
                """
                {
                  "id": "f_email",
                  "key": "email",
                  "type": "email",
                  "label": "Email",
                  "validation": {"required": true, "pattern": "^.+@.+$", "max": 120},
                  "ui": {"placeholder": "you@example.com", "description": "Work address"},
                  "logic": {"showWhen": {"mode": "any", "rules": [
                    {"fieldKey": "contact", "operator": "eq", "value": "email"}
                  ]}}
                }
                """));

    assertThat(field.fieldId()).isEqualTo("f_email");
    assertThat(field.key()).isEqualTo("email");
    assertThat(field.type()).isEqualTo(FieldType.EMAIL);
    assertThat(field.label()).isEqualTo("Email");
    assertThat(field.required()).isTrue();
    assertThat(field.placeholder()).isEqualTo("you@example.com");
    assertThat(field.description()).isEqualTo("Work address");
    assertThat(field.validation().pattern()).isEqualTo("^.+@.+$");
    assertThat(field.validation().max()).isEqualByComparingTo("120");
    assertThat(field.validation().min()).isNull();
    assertThat(field.file()).isNull();
    assertThat(field.logic().requireWhen()).isNull();
    assertThat(field.logic().showWhen().mode()).isEqualTo(ConditionMode.ANY);
    assertThat(field.logic().showWhen().rules())
        .containsExactly(new ConditionRule("contact", ConditionOperator.EQUALS, "email"));
  }

  @Test
  void missingKeyFallsBackToFieldId() {
    var field = FieldSchemaParser.parse(Map.of("id", "f_1", "key", "", "label", "Name"));

    assertThat(field.key()).isEqualTo("f_1");
    assertThat(field.effectiveKey()).isEqualTo("f_1");
  }

  @Test
  void missingIdIsGeneratedAndLabelDefaults() {
    var field = FieldSchemaParser.parse(Map.of());

    assertThat(field.fieldId()).startsWith("field_").hasSize("field_".length() + 12);
    assertThat(field.key()).isEqualTo(field.fieldId());
    assertThat(field.label()).isEqualTo("Field");
    assertThat(field.type()).isEqualTo(FieldType.TEXT);
    assertThat(field.required()).isFalse();
    assertThat(field.options()).isEmpty();
    assertThat(field.validation()).isNull();
    assertThat(field.logic()).isNull();
  }

  @Test
  void numericIdIsStringified() {
    assertThat(FieldSchemaParser.parse(Map.of("id", 7)).fieldId()).isEqualTo("7");
  }

  @ParameterizedTest
  @CsvSource({
    "text, TEXT",
    "TEXTAREA, TEXTAREA",
    "multiselect, MULTISELECT",
    "multi_select, MULTISELECT",
    "file_upload, FILE",
    "file, FILE",
    "' Info_Text ', INFO_TEXT",
    "essay, TEXT"
  })
  void resolvesTypeTokensAndSynonyms(String token, FieldType expected) {
    assertThat(FieldSchemaParser.parseType(token)).isEqualTo(expected);
  }

  @Test
  void readsFlatLegacyMembers() {
    var field =
        FieldSchemaParser.parse(
            SchemaFixtures.parseJson(
                """
                {
                  "id": "f_age",
                  "type": "number",
                  "label": "Age",
                  "required": "TRUE",
                  "min": "18",
                  "max": 99.5,
                  "placeholder": "Years",
                  "showWhen": {"rules": [{"fieldKey": "adult", "operator": "exists"}]},
                  "requireWhen": {"rules": [{"fieldKey": "visa", "operator": "neq", "value": "x"}]}
                }
                """));

    assertThat(field.required()).isTrue();
    assertThat(field.validation().min()).isEqualTo(new BigDecimal("18"));
    assertThat(field.validation().max()).isEqualTo(new BigDecimal("99.5"));
    assertThat(field.placeholder()).isEqualTo("Years");
    assertThat(field.logic().showWhen().rules())
        .extracting(ConditionRule::fieldKey)
        .containsExactly("adult");
    assertThat(field.logic().requireWhen().rules())
        .extracting(ConditionRule::fieldKey)
        .containsExactly("visa");
  }

  @Test
  void nestedMembersWinOverFlatOnes() {
    var field =
        FieldSchemaParser.parse(
            Map.of(
                "id", "f_1",
                "required", true,
                "placeholder", "flat",
                "validation", Map.of("required", false, "min", 3),
                "min", 1,
                "ui", Map.of("placeholder", "nested")));

    assertThat(field.required()).isFalse();
    assertThat(field.validation().min()).isEqualByComparingTo("3");
    assertThat(field.placeholder()).isEqualTo("nested");
  }

  @Test
  void requiredAcceptsOnlyTruthyValues() {
    assertThat(FieldSchemaParser.parse(Map.of("required", 1)).required()).isTrue();
    assertThat(FieldSchemaParser.parse(Map.of("required", 0)).required()).isFalse();
    assertThat(FieldSchemaParser.parse(Map.of("required", "yes")).required()).isFalse();
    assertThat(FieldSchemaParser.parse(Map.of("required", List.of())).required()).isFalse();
  }

  @Test
  void nonFiniteAndUnparseableNumbersAreDropped() {
    var field =
        FieldSchemaParser.parse(
            Map.of("validation", Map.of("min", "abc", "max", Double.POSITIVE_INFINITY)));

    assertThat(field.validation()).isNull();
  }

  @Test
  void keepsOnlyOptionsWithStringLabelAndValue() {
    var field =
        FieldSchemaParser.parse(
            SchemaFixtures.parseJson(
                """
                {"type": "select", "options": [
                  {"label": "Yes", "value": "yes"},
                  {"label": 1, "value": "one"},
                  {"label": "No"},
                  "maybe"
                ]}
                """));

    assertThat(field.options()).containsExactly(new FieldOption("Yes", "yes"));
  }

  @Test
  void readsFileConstraintsAndFallsBackToAllowedTypes() {
    var fromUi =
        FieldSchemaParser.parse(
            Map.of(
                "type", "file_upload",
                "ui",
                    Map.of(
                        "allowedMimeTypes", List.of("image/png", " "),
                        "maxFileSizeMB", "2.5",
                        "maxFiles", 3)));
    var fromValidation =
        FieldSchemaParser.parse(
            Map.of(
                "type", "file", "validation", Map.of("allowedTypes", List.of("application/pdf"))));

    assertThat(fromUi.file().allowedMimeTypes()).containsExactly("image/png");
    assertThat(fromUi.file().maxFileSizeMB()).isEqualByComparingTo("2.5");
    assertThat(fromUi.file().maxFiles()).isEqualByComparingTo("3");
    assertThat(fromValidation.file().allowedMimeTypes()).containsExactly("application/pdf");
    assertThat(fromValidation.file().maxFiles()).isNull();
  }
}
