package io.applyflow.forms.schema;

import static org.assertj.core.api.Assertions.assertThat;

import io.applyflow.forms.condition.ConditionGroup;
import io.applyflow.forms.condition.ConditionMode;
import io.applyflow.forms.condition.ConditionOperator;
import io.applyflow.forms.condition.ConditionRule;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ConditionGroupParserTest {

  @Test
  void readsCanonicalGroup() {
    var group =
        ConditionGroupParser.parse(
            SchemaFixtures.parseJson(
                """
                {"mode": "any", "rules": [
                  {"fieldKey": "country", "operator": "eq", "value": "NZ"},
                  {"fieldKey": "visa", "operator": "exists"}
                ]}
                """));

    assertThat(group.mode()).isEqualTo(ConditionMode.ANY);
    assertThat(group.rules())
        .containsExactly(
            new ConditionRule("country", ConditionOperator.EQUALS, "NZ"),
            ConditionRule.presence("visa", ConditionOperator.EXISTS));
  }

  @Test
  void readsLegacyConditionsAndKeyMembers() {
    var group =
        ConditionGroupParser.parse(
            SchemaFixtures.parseJson(
                """
                {"conditions": [{"key": " age ", "operator": ">=", "value": 18}]}
                """));

    assertThat(group.mode()).isEqualTo(ConditionMode.ALL);
    assertThat(group.rules())
        .containsExactly(new ConditionRule("age", ConditionOperator.GREATER_OR_EQUAL, "18"));
  }

  @Test
  void dropsRulesWithoutUsableKeyAndGroupsLeftEmpty() {
    var raw =
        Map.of(
            "mode",
            "all",
            "rules",
            List.of(Map.of("fieldKey", "  "), Map.of("operator", "eq"), "not-a-rule", 42));

    assertThat(ConditionGroupParser.parse(raw)).isNull();
    assertThat(ConditionGroupParser.parse(Map.of("rules", List.of()))).isNull();
    assertThat(ConditionGroupParser.parse(Map.of("mode", "any"))).isNull();
    assertThat(ConditionGroupParser.parse("showWhen")).isNull();
    assertThat(ConditionGroupParser.parse(null)).isNull();
  }

  @Test
  void stringifiesNonStringValues() {
    var group =
        ConditionGroupParser.parse(
            SchemaFixtures.parseJson(
                """
                {"rules": [
                  {"fieldKey": "score", "operator": "gt", "value": 2.50},
                  {"fieldKey": "agree", "operator": "eq", "value": true},
                  {"fieldKey": "tier", "operator": "in", "value": ["gold", "silver"]}
                ]}
                """));

    assertThat(group.rules())
        .extracting(ConditionRule::value)
        .containsExactly("2.5", "true", "gold,silver");
  }

  @Test
  void presenceRulesReadWithoutValueEvenWhenOneIsStored() {
    var group =
        ConditionGroupParser.parse(
            Map.of(
                "rules",
                List.of(Map.of("fieldKey", "visa", "operator", "NOT EXISTS", "value", "x"))));

    assertThat(group.rules().get(0).operator()).isEqualTo(ConditionOperator.NOT_EXISTS);
    assertThat(group.rules().get(0).hasValue()).isFalse();
  }

  @Test
  void writesCanonicalShapeAndOmitsAbsentValues() {
    var group =
        new ConditionGroup(
            ConditionMode.ANY,
            List.of(
                new ConditionRule("country", ConditionOperator.NOT_IN_LIST, "NZ,AU"),
                ConditionRule.presence("visa", ConditionOperator.EXISTS),
                new ConditionRule("age", ConditionOperator.LESS_THAN, null)));

    var out = ConditionGroupSerializer.serialize(group);

    assertThat(out)
        .isEqualTo(
            Map.of(
                "mode",
                "any",
                "rules",
                List.of(
                    Map.of("fieldKey", "country", "operator", "not_in", "value", "NZ,AU"),
                    Map.of("fieldKey", "visa", "operator", "exists"),
                    Map.of("fieldKey", "age", "operator", "lt"))));
  }
}
