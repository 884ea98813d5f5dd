package io.pricerule.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The structured form of a pricing rule: declared variables, an ordered condition list and
 * the formula to apply.
 *
 * <p>
 * {@code formula} is an arithmetic expression, optionally followed by {@code ELSE} and a second
 * expression that applies when the conditions do not hold.
 *
 * <p>
 * Immutable. Edits return a new instance, so a caller holding the previous definition keeps
 * it intact when a later parse fails.
 */
public record Definition(List<Variable> variables, List<Condition> conditions, String formula) {

    public Definition {
        variables = variables != null ? List.copyOf(variables) : List.of();
        conditions = conditions != null ? List.copyOf(conditions) : List.of();
        formula = formula != null ? formula : "";
    }

    /** A fresh definition holding only the reserved variables. */
    public static Definition initial() {
        return new Definition(ReservedVariables.ALL, List.of(), "");
    }

    public Optional<Variable> variable(String key) {
        for (Variable variable : variables) {
            if (variable.key().equals(key)) {
                return Optional.of(variable);
            }
        }
        return Optional.empty();
    }

    public boolean hasVariable(String key) {
        return variable(key).isPresent();
    }

    public Definition withVariables(List<Variable> newVariables) {
        return new Definition(newVariables, conditions, formula);
    }

    public Definition withConditions(List<Condition> newConditions) {
        return new Definition(variables, newConditions, formula);
    }

    public Definition withFormula(String newFormula) {
        return new Definition(variables, conditions, newFormula);
    }

    /** Returns a copy with {@code variable} appended. */
    public Definition plusVariable(Variable variable) {
        Objects.requireNonNull(variable, "variable must not be null");
        List<Variable> next = new ArrayList<>(variables);
        next.add(variable);
        return withVariables(next);
    }
}
