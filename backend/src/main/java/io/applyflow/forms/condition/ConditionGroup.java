package io.applyflow.forms.condition;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/** A non-empty list of rules combined with ALL or ANY semantics. */
public record ConditionGroup(ConditionMode mode, List<ConditionRule> rules) {

  public ConditionGroup {
    Objects.requireNonNull(mode, "mode");
    if (rules == null || rules.isEmpty()) {
      throw new IllegalArgumentException("A condition group needs at least one rule");
    }
    rules = List.copyOf(rules);
  }

  /** Returns a group of the given rules, or null when none are left. */
  public static ConditionGroup ofNullable(ConditionMode mode, List<ConditionRule> rules) {
    return rules == null || rules.isEmpty() ? null : new ConditionGroup(mode, rules);
  }

  public ConditionGroup withMode(ConditionMode newMode) {
    return new ConditionGroup(newMode, rules);
  }

  public ConditionGroup withRuleAdded(ConditionRule rule) {
    var next = new ArrayList<>(rules);
    next.add(rule);
    return new ConditionGroup(mode, next);
  }

  /** Replaces the rule at {@code index}. */
  public ConditionGroup withRuleReplaced(int index, UnaryOperator<ConditionRule> update) {
    Objects.checkIndex(index, rules.size());
    var next = new ArrayList<>(rules);
    next.set(index, update.apply(rules.get(index)));
    return new ConditionGroup(mode, next);
  }

  /** Removes the rule at {@code index}; null when it was the last one. */
  public ConditionGroup withoutRule(int index) {
    Objects.checkIndex(index, rules.size());
    var next = new ArrayList<>(rules);
    next.remove(index);
    return ofNullable(mode, next);
  }

  /** Keeps the matching rules; null when none survive. */
  public ConditionGroup retainRules(Predicate<ConditionRule> keep) {
    var next = rules.stream().filter(keep).toList();
    return next.size() == rules.size() ? this : ofNullable(mode, next);
  }

  /** Applies {@code update} to every rule. */
  public ConditionGroup mapRules(UnaryOperator<ConditionRule> update) {
    return new ConditionGroup(mode, rules.stream().map(update).toList());
  }
}
