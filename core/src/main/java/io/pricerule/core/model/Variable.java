package io.pricerule.core.model;

import java.util.Objects;

/**
 * A named, typed value a rule can refer to.
 *
 * @param key          unique snake_case identifier
 * @param label        display name
 * @param type         declared type
 * @param initialValue default value as text, or {@code null}
 * @param userInput    {@code true} when the value is asked from the guest at checkout; only
 *                     meaningful for number and text variables
 */
public record Variable(String key, String label, VariableType type, String initialValue, boolean userInput) {

    public Variable {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(label, "label must not be null");
        Objects.requireNonNull(type, "type must not be null");
    }

    public static Variable of(String key, String label, VariableType type) {
        return new Variable(key, label, type, null, false);
    }
}
