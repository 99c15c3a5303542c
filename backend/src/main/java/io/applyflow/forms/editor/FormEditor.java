package io.applyflow.forms.editor;

import io.applyflow.forms.condition.ConditionGroup;
import io.applyflow.forms.condition.ConditionMode;
import io.applyflow.forms.condition.ConditionOperator;
import io.applyflow.forms.condition.ConditionOperatorNormalizer;
import io.applyflow.forms.condition.ConditionRule;
import io.applyflow.forms.condition.FieldLogic;
import io.applyflow.forms.condition.LogicTarget;
import io.applyflow.forms.exception.InvalidStateException;
import io.applyflow.forms.exception.ResourceNotFoundException;
import io.applyflow.forms.formdefinition.FormDefinition;
import io.applyflow.forms.formdefinition.FormField;
import io.applyflow.forms.formdefinition.FormIds;
import io.applyflow.forms.formdefinition.FormSection;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Editing operations over the canonical form model. Every operation returns a new {@link
 * FormDefinition} and leaves its input untouched.
 *
 * <p>The operations keep the conditional logic consistent:
 *
 * <ul>
 *   <li>a rule can only point at another existing field's key
 *   <li>renaming a key re-targets the rules that pointed at the old key
 *   <li>deleting a field or section drops the rules left pointing at nothing
 *   <li>a group that loses its last rule is removed, and so is logic left without groups
 * </ul>
 *
 * <p>Unknown section or field ids raise {@link ResourceNotFoundException}; edits that would break
 * the rules above raise {@link InvalidStateException}.
 */
public final class FormEditor {

  static final String NEW_FIELD_LABEL = "New field";

  private FormEditor() {}

  // --- Sections ---

  public static FormDefinition addSection(FormDefinition form) {
    var sections = new ArrayList<>(form.sections());
    sections.add(
        new FormSection(
            FormIds.newSectionId(), "Section " + (sections.size() + 1), null, List.of()));
    return form.withSections(sections);
  }

  public static FormDefinition updateSection(
      FormDefinition form, String sectionId, UnaryOperator<FormSection> update) {
    requireSection(form, sectionId);
    return form.withSections(
        form.sections().stream()
            .map(section -> section.id().equals(sectionId) ? update.apply(section) : section)
            .toList());
  }

  public static FormDefinition removeSection(FormDefinition form, String sectionId) {
    var removed = requireSection(form, sectionId);
    var next =
        form.withSections(
            form.sections().stream().filter(section -> !section.id().equals(sectionId)).toList());
    return dropRulesTargeting(next, keysOf(removed.fields()));
  }

  // --- Fields ---

  /** Appends a short text field whose key is its freshly generated id. */
  public static FormDefinition addField(FormDefinition form, String sectionId) {
    var field = FormField.create(FormIds.newFieldId(), NEW_FIELD_LABEL);
    return updateSection(
        form,
        sectionId,
        section -> {
          var fields = new ArrayList<>(section.fields());
          fields.add(field);
          return section.withFields(fields);
        });
  }

  /**
   * Applies {@code update} to one field. The field id cannot be changed, and key changes must go
   * through {@link #renameFieldKey} so that rules follow the key.
   */
  public static FormDefinition updateField(
      FormDefinition form, String sectionId, String fieldId, UnaryOperator<FormField> update) {
    return updateSection(
        form,
        sectionId,
        section -> {
          requireField(section, fieldId);
          return section.withFields(
              section.fields().stream()
                  .map(field -> field.fieldId().equals(fieldId) ? apply(field, update) : field)
                  .toList());
        });
  }

  public static FormDefinition removeField(FormDefinition form, String sectionId, String fieldId) {
    var section = requireSection(form, sectionId);
    var removed = requireField(section, fieldId);
    var next =
        updateSection(
            form,
            sectionId,
            s ->
                s.withFields(
                    s.fields().stream().filter(f -> !f.fieldId().equals(fieldId)).toList()));
    return dropRulesTargeting(next, Set.of(removed.effectiveKey()));
  }

  /** Moves a field to {@code toIndex} within its section, clamped to the section bounds. */
  public static FormDefinition moveField(
      FormDefinition form, String sectionId, String fieldId, int toIndex) {
    return updateSection(
        form,
        sectionId,
        section -> {
          var field = requireField(section, fieldId);
          var fields = new ArrayList<>(section.fields());
          fields.remove(field);
          fields.add(Math.max(0, Math.min(toIndex, fields.size())), field);
          return section.withFields(fields);
        });
  }

  /**
   * Changes a field's key. Rules that pointed at the old key are re-targeted at the new one,
   * unless another field still answers to the old key.
   */
  public static FormDefinition renameFieldKey(FormDefinition form, String fieldId, String newKey) {
    var field =
        form.findField(fieldId).orElseThrow(() -> new ResourceNotFoundException("Field", fieldId));
    var oldKey = field.effectiveKey();
    var renamed = field.withKey(newKey == null ? fieldId : newKey);
    var newEffectiveKey = renamed.effectiveKey();

    var next = mapFields(form, f -> f.fieldId().equals(fieldId) ? renamed : f);
    boolean oldKeyStillUsed = next.fields().anyMatch(f -> f.effectiveKey().equals(oldKey));
    if (oldKeyStillUsed || oldKey.equals(newEffectiveKey)) {
      return next;
    }
    return mapRules(
        next,
        rule -> rule.fieldKey().equals(oldKey) ? rule.withFieldKey(newEffectiveKey) : rule);
  }

  /**
   * Appends one option per non-blank line of {@code text} to a field's options. Only select and
   * multi-select fields take options.
   */
  public static FormDefinition addBulkOptions(
      FormDefinition form, String sectionId, String fieldId, String text) {
    var added = BulkOptionParser.parse(text);
    if (added.isEmpty()) {
      return form;
    }
    return updateField(
        form,
        sectionId,
        fieldId,
        field -> {
          if (!field.type().hasOptions()) {
            throw new InvalidStateException(
                "Field has no options",
                "Field '"
                    + fieldId
                    + "' of type "
                    + field.type().getSchemaToken()
                    + " does not take options");
          }
          var options = new ArrayList<>(field.options());
          options.addAll(added);
          return field.withOptions(options);
        });
  }

  // --- Conditional logic ---

  /** The fields a rule on {@code fieldId} may point at: every other field, in form order. */
  public static List<LogicFieldOption> availableLogicFields(FormDefinition form, String fieldId) {
    var field =
        form.findField(fieldId).orElseThrow(() -> new ResourceNotFoundException("Field", fieldId));
    var ownKey = field.effectiveKey();
    return form.fields()
        .filter(other -> !other.effectiveKey().equals(ownKey))
        .map(other -> new LogicFieldOption(other.effectiveKey(), displayLabel(other)))
        .toList();
  }

  /**
   * Turns a condition group on with one equals rule against the first available field. Does
   * nothing when the group is already on.
   */
  public static FormDefinition enableCondition(
      FormDefinition form, String sectionId, String fieldId, LogicTarget target) {
    var field = requireField(requireSection(form, sectionId), fieldId);
    if (field.logic() != null && field.logic().group(target) != null) {
      return form;
    }
    var group = new ConditionGroup(ConditionMode.ALL, List.of(starterRule(form, fieldId)));
    return setConditionGroup(form, sectionId, fieldId, target, group);
  }

  /** Replaces a group; a null group turns it off. */
  public static FormDefinition setConditionGroup(
      FormDefinition form,
      String sectionId,
      String fieldId,
      LogicTarget target,
      ConditionGroup group) {
    if (group != null) {
      var allowed = allowedKeys(form, fieldId);
      for (var rule : group.rules()) {
        requireAllowedKey(allowed, rule.fieldKey());
      }
    }
    return updateField(
        form,
        sectionId,
        fieldId,
        field ->
            field.withLogic(
                field.logic() == null
                    ? FieldLogic.ofNullable(
                        target == LogicTarget.SHOW_WHEN ? group : null,
                        target == LogicTarget.REQUIRE_WHEN ? group : null)
                    : field.logic().withGroup(target, group)));
  }

  /** Appends an equals rule against the first available field, enabling the group if needed. */
  public static FormDefinition addRule(
      FormDefinition form, String sectionId, String fieldId, LogicTarget target) {
    var field = requireField(requireSection(form, sectionId), fieldId);
    if (field.logic() == null || field.logic().group(target) == null) {
      return enableCondition(form, sectionId, fieldId, target);
    }
    var rule = starterRule(form, fieldId);
    return updateGroup(form, sectionId, fieldId, target, group -> group.withRuleAdded(rule));
  }

  /** Removes one rule; removing the last rule turns the group off. */
  public static FormDefinition removeRule(
      FormDefinition form, String sectionId, String fieldId, LogicTarget target, int ruleIndex) {
    return updateGroup(
        form,
        sectionId,
        fieldId,
        target,
        group -> group.withoutRule(requireRuleIndex(group, ruleIndex)));
  }

  public static FormDefinition changeRuleField(
      FormDefinition form,
      String sectionId,
      String fieldId,
      LogicTarget target,
      int ruleIndex,
      String fieldKey) {
    var key = fieldKey == null ? "" : fieldKey.trim();
    requireAllowedKey(allowedKeys(form, fieldId), key);
    return updateGroup(
        form,
        sectionId,
        fieldId,
        target,
        group ->
            group.withRuleReplaced(
                requireRuleIndex(group, ruleIndex), rule -> rule.withFieldKey(key)));
  }

  /**
   * Switches a rule's operator, accepting any spelling the normalizer knows. Presence operators
   * drop the rule's value.
   */
  public static FormDefinition changeRuleOperator(
      FormDefinition form,
      String sectionId,
      String fieldId,
      LogicTarget target,
      int ruleIndex,
      Object operator) {
    ConditionOperator normalized = ConditionOperatorNormalizer.normalize(operator);
    return updateGroup(
        form,
        sectionId,
        fieldId,
        target,
        group ->
            group.withRuleReplaced(
                requireRuleIndex(group, ruleIndex), rule -> rule.withOperator(normalized)));
  }

  public static FormDefinition changeRuleValue(
      FormDefinition form,
      String sectionId,
      String fieldId,
      LogicTarget target,
      int ruleIndex,
      String value) {
    return updateGroup(
        form,
        sectionId,
        fieldId,
        target,
        group ->
            group.withRuleReplaced(
                requireRuleIndex(group, ruleIndex), rule -> rule.withValue(value)));
  }

  public static FormDefinition changeMode(
      FormDefinition form,
      String sectionId,
      String fieldId,
      LogicTarget target,
      ConditionMode mode) {
    Objects.requireNonNull(mode, "mode");
    return updateGroup(form, sectionId, fieldId, target, group -> group.withMode(mode));
  }

  /** Drops every rule that points at its own field or at a key no other field carries. */
  public static FormDefinition pruneOrphanedRules(FormDefinition form) {
    var fields = form.fields().toList();
    return mapFields(
        form,
        field -> {
          if (field.logic() == null) {
            return field;
          }
          var otherKeys = FormLogicValidator.keysExcluding(fields, field);
          return field.withLogic(
              field
                  .logic()
                  .mapGroups(
                      group -> group.retainRules(rule -> otherKeys.contains(rule.fieldKey()))));
        });
  }

  // --- Internals ---

  private static FormDefinition updateGroup(
      FormDefinition form,
      String sectionId,
      String fieldId,
      LogicTarget target,
      UnaryOperator<ConditionGroup> update) {
    var field = requireField(requireSection(form, sectionId), fieldId);
    var current = field.logic() == null ? null : field.logic().group(target);
    if (current == null) {
      throw new InvalidStateException(
          "Condition not enabled",
          "Field '" + fieldId + "' has no " + target.getSchemaKey() + " condition");
    }
    return updateField(
        form,
        sectionId,
        fieldId,
        f -> f.withLogic(f.logic().withGroup(target, update.apply(current))));
  }

  private static int requireRuleIndex(ConditionGroup group, int ruleIndex) {
    if (ruleIndex < 0 || ruleIndex >= group.rules().size()) {
      throw new ResourceNotFoundException("Rule", ruleIndex);
    }
    return ruleIndex;
  }

  private static FormDefinition dropRulesTargeting(FormDefinition form, Set<String> removedKeys) {
    var remainingKeys = keysOf(form.fields().toList());
    var orphaned =
        removedKeys.stream()
            .filter(key -> !remainingKeys.contains(key))
            .collect(Collectors.toUnmodifiableSet());
    if (orphaned.isEmpty()) {
      return form;
    }
    return mapFields(
        form,
        field ->
            field.logic() == null
                ? field
                : field.withLogic(
                    field
                        .logic()
                        .mapGroups(
                            group ->
                                group.retainRules(rule -> !orphaned.contains(rule.fieldKey())))));
  }

  private static FormDefinition mapRules(
      FormDefinition form, UnaryOperator<ConditionRule> update) {
    return mapFields(
        form,
        field ->
            field.logic() == null
                ? field
                : field.withLogic(field.logic().mapGroups(group -> group.mapRules(update))));
  }

  private static FormDefinition mapFields(FormDefinition form, UnaryOperator<FormField> update) {
    return form.withSections(
        form.sections().stream()
            .map(section -> section.withFields(section.fields().stream().map(update).toList()))
            .toList());
  }

  private static FormField apply(FormField field, UnaryOperator<FormField> update) {
    var updated = update.apply(field);
    if (!updated.fieldId().equals(field.fieldId())) {
      throw new InvalidStateException(
          "Field id is immutable", "Field id '" + field.fieldId() + "' cannot be changed");
    }
    return updated;
  }

  private static ConditionRule starterRule(FormDefinition form, String fieldId) {
    var available = availableLogicFields(form, fieldId);
    if (available.isEmpty()) {
      throw new InvalidStateException(
          "No fields to reference", "Add at least one other field before enabling conditions");
    }
    return new ConditionRule(available.get(0).key(), ConditionOperator.EQUALS, "");
  }

  private static Set<String> allowedKeys(FormDefinition form, String fieldId) {
    return availableLogicFields(form, fieldId).stream()
        .map(LogicFieldOption::key)
        .collect(Collectors.toUnmodifiableSet());
  }

  private static void requireAllowedKey(Set<String> allowed, String fieldKey) {
    if (!allowed.contains(fieldKey)) {
      throw new InvalidStateException(
          "Invalid condition rule",
          "Field key '" + fieldKey + "' does not reference another field of this form");
    }
  }

  private static FormSection requireSection(FormDefinition form, String sectionId) {
    return form.findSection(sectionId)
        .orElseThrow(() -> new ResourceNotFoundException("Section", sectionId));
  }

  private static FormField requireField(FormSection section, String fieldId) {
    return section.fields().stream()
        .filter(field -> field.fieldId().equals(fieldId))
        .findFirst()
        .orElseThrow(() -> new ResourceNotFoundException("Field", fieldId));
  }

  private static Set<String> keysOf(List<FormField> fields) {
    return fields.stream().map(FormField::effectiveKey).collect(Collectors.toUnmodifiableSet());
  }

  private static String displayLabel(FormField field) {
    var label = field.label().trim();
    if (!label.isEmpty()) {
      return label;
    }
    return field.key().isEmpty() ? field.fieldId() : field.key();
  }
}
