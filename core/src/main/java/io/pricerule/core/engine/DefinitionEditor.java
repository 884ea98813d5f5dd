package io.pricerule.core.engine;

import io.pricerule.core.error.InvalidDefinitionException;
import io.pricerule.core.error.UnknownVariableException;
import io.pricerule.core.model.Condition;
import io.pricerule.core.model.Definition;
import io.pricerule.core.model.Operand;
import io.pricerule.core.model.ReservedVariables;
import io.pricerule.core.model.ValueType;
import io.pricerule.core.model.Variable;
import io.pricerule.core.model.VariableType;
import io.pricerule.core.parser.RuleTextParser;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Authoring edits on a {@link Definition}. Every method returns a new instance and leaves its
 * argument untouched.
 */
public final class DefinitionEditor {

    private static final Pattern PLAIN_NUMBER = Pattern.compile("^[+-]?\\d+(\\.\\d+)?$");

    private final ArithmeticEvaluator evaluator;

    public DefinitionEditor(ArithmeticEvaluator evaluator) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
    }

    /**
     * Declares a new variable whose key is derived from {@code label}.
     *
     * @param initialValue ignored for user-input variables
     * @throws InvalidDefinitionException if the label is blank or the type cannot be user input
     */
    public Definition addVariable(
            Definition definition, String label, VariableType type, String initialValue, boolean userInput) {
        String trimmedLabel = label == null ? "" : label.trim();
        if (trimmedLabel.isEmpty()) {
            throw new InvalidDefinitionException("Give the variable a label.", "label");
        }
        Objects.requireNonNull(type, "type must not be null");
        if (userInput && !type.supportsUserInput()) {
            throw new InvalidDefinitionException(
                    "Only number and text variables can be user input.", "userInput");
        }
        List<String> existing =
                definition.variables().stream().map(Variable::key).collect(Collectors.toList());
        String key = uniqueKey(trimmedLabel, existing);
        String value = userInput || initialValue == null || initialValue.isEmpty() ? null : initialValue;
        return definition.plusVariable(new Variable(key, trimmedLabel, type, value, userInput));
    }

    /**
     * Derives a snake_case key from {@code desired}: lowercase, runs of other characters
     * collapsed to {@code _}, edge underscores dropped, {@code custom} when nothing remains.
     * Clashes with existing keys or rule keywords get {@code _1}, {@code _2}, ... appended.
     */
    public static String uniqueKey(String desired, Collection<String> existing) {
        String normalized = desired.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "_")
                .replaceAll("^_+|_+$", "");
        if (normalized.isEmpty()) {
            normalized = "custom";
        }
        if (!existing.contains(normalized) && !ReservedVariables.isKeyword(normalized)) {
            return normalized;
        }
        int suffix = 1;
        while (existing.contains(normalized + "_" + suffix)) {
            suffix++;
        }
        return normalized + "_" + suffix;
    }

    /**
     * Removes a variable nothing refers to.
     *
     * @throws InvalidDefinitionException if the key is reserved or still in use
     * @throws UnknownVariableException   if no such variable is declared
     */
    public Definition removeVariable(Definition definition, String key) {
        if (ReservedVariables.isReserved(key)) {
            throw new InvalidDefinitionException(
                    "\"" + key + "\" is built in and cannot be removed.", "variables");
        }
        if (!definition.hasVariable(key)) {
            throw new UnknownVariableException(key, null);
        }
        if (usedVariables(definition).contains(key)) {
            throw new InvalidDefinitionException(
                    "Variable \"" + key + "\" is used by the rule and cannot be removed.", "variables");
        }
        List<Variable> remaining = new ArrayList<>(definition.variables());
        remaining.removeIf(variable -> variable.key().equals(key));
        return definition.withVariables(remaining);
    }

    /**
     * Removes the condition with {@code id}; the condition that becomes first loses its
     * connector. Returns {@code definition} itself when no condition has that id.
     */
    public Definition removeCondition(Definition definition, String id) {
        List<Condition> remaining = new ArrayList<>(definition.conditions());
        if (!remaining.removeIf(condition -> condition.id().equals(id))) {
            return definition;
        }
        if (!remaining.isEmpty()) {
            remaining.set(0, remaining.get(0).withConnector(null));
        }
        return definition.withConditions(remaining);
    }

    /** Keys referenced by any condition operand or by the formula, in first-use order. */
    public Set<String> usedVariables(Definition definition) {
        Set<String> used = new LinkedHashSet<>();
        List<String> declared =
                definition.variables().stream().map(Variable::key).collect(Collectors.toList());
        for (Condition condition : definition.conditions()) {
            collect(condition.left(), declared, used);
            collect(condition.right(), declared, used);
        }
        if (!definition.formula().isBlank()) {
            RuleTextParser.Branches branches = RuleTextParser.splitBranches(definition.formula());
            used.addAll(evaluator.referencedVariables(branches.thenFormula(), declared));
            if (branches.elseFormula() != null) {
                used.addAll(evaluator.referencedVariables(branches.elseFormula(), declared));
            }
        }
        return used;
    }

    /** Number literals may be expressions over variables, e.g. {@code booking_hours * 2}. */
    private void collect(Operand operand, List<String> declared, Set<String> used) {
        if (operand instanceof Operand.VariableRef ref) {
            used.add(ref.key());
        } else if (operand instanceof Operand.Literal literal
                && literal.valueType() == ValueType.NUMBER
                && !PLAIN_NUMBER.matcher(literal.value()).matches()) {
            used.addAll(evaluator.referencedVariables(literal.value(), declared));
        }
    }
}
