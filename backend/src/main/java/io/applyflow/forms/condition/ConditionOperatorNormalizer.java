package io.applyflow.forms.condition;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps any accepted spelling of a comparison operator to a {@link ConditionOperator}.
 *
 * <p>Accepted: the persisted tokens ({@code eq}, {@code not_in}, ...), the enum names, the
 * symbols {@code == = != <> > >= < <=}, and case, spacing, hyphen and underscore variants of the
 * above ({@code notExists}, {@code NOT EXISTS}, {@code not-in}). Anything else is {@link
 * ConditionOperator#EQUALS}.
 */
public final class ConditionOperatorNormalizer {

  static final ConditionOperator DEFAULT_OPERATOR = ConditionOperator.EQUALS;

  private static final Map<String, ConditionOperator> SYMBOLS =
      Map.of(
          "==", ConditionOperator.EQUALS,
          "=", ConditionOperator.EQUALS,
          "!=", ConditionOperator.NOT_EQUALS,
          "<>", ConditionOperator.NOT_EQUALS,
          ">", ConditionOperator.GREATER_THAN,
          ">=", ConditionOperator.GREATER_OR_EQUAL,
          "<", ConditionOperator.LESS_THAN,
          "<=", ConditionOperator.LESS_OR_EQUAL);

  // keyed by the lower-cased spelling with separators removed
  private static final Map<String, ConditionOperator> NAMES = buildNames();

  private ConditionOperatorNormalizer() {}

  public static ConditionOperator normalize(Object raw) {
    if (raw == null) {
      return DEFAULT_OPERATOR;
    }
    String token = raw.toString().trim().toLowerCase(Locale.ROOT);
    var symbol = SYMBOLS.get(token);
    if (symbol != null) {
      return symbol;
    }
    return NAMES.getOrDefault(compact(token), DEFAULT_OPERATOR);
  }

  private static Map<String, ConditionOperator> buildNames() {
    var names = new HashMap<String, ConditionOperator>();
    for (var operator : ConditionOperator.values()) {
      names.put(compact(operator.getToken()), operator);
      names.put(compact(operator.name().toLowerCase(Locale.ROOT)), operator);
    }
    return Map.copyOf(names);
  }

  private static String compact(String token) {
    return token.replaceAll("[\\s_-]+", "");
  }
}
