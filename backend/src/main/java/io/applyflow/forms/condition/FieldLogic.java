package io.applyflow.forms.condition;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/** Visibility and requiredness rules of a field. At least one group is always present. */
public record FieldLogic(ConditionGroup showWhen, ConditionGroup requireWhen) {

  public FieldLogic {
    if (showWhen == null && requireWhen == null) {
      throw new IllegalArgumentException("Field logic needs showWhen or requireWhen");
    }
  }

  /** Returns the logic for the given groups, or null when both are absent. */
  public static FieldLogic ofNullable(ConditionGroup showWhen, ConditionGroup requireWhen) {
    return showWhen == null && requireWhen == null ? null : new FieldLogic(showWhen, requireWhen);
  }

  public ConditionGroup group(LogicTarget target) {
    return switch (target) {
      case SHOW_WHEN -> showWhen;
      case REQUIRE_WHEN -> requireWhen;
    };
  }

  /** Replaces one group; null when that leaves the logic empty. */
  public FieldLogic withGroup(LogicTarget target, ConditionGroup group) {
    return switch (target) {
      case SHOW_WHEN -> ofNullable(group, requireWhen);
      case REQUIRE_WHEN -> ofNullable(showWhen, group);
    };
  }

  /** Applies {@code update} to both groups; null when neither survives. */
  public FieldLogic mapGroups(UnaryOperator<ConditionGroup> update) {
    return ofNullable(
        showWhen == null ? null : update.apply(showWhen),
        requireWhen == null ? null : update.apply(requireWhen));
  }

  /** All rules of both groups, showWhen first. */
  public List<ConditionRule> allRules() {
    var rules = new ArrayList<ConditionRule>();
    if (showWhen != null) {
      rules.addAll(showWhen.rules());
    }
    if (requireWhen != null) {
      rules.addAll(requireWhen.rules());
    }
    return rules;
  }
}
