package io.pricerule.core.model;

import java.util.Locale;

/**
 * Declared type of a rule {@link Variable}. The lowercase {@link #jsonName()} is the form used
 * in persisted definitions.
 */
public enum VariableType {
    NUMBER,
    TEXT,
    DATE,
    TIME;

    /** Lowercase name used in JSON and in error messages. */
    public String jsonName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Whether a variable of this type may be flagged as user input. */
    public boolean supportsUserInput() {
        return this == NUMBER || this == TEXT;
    }

    /**
     * Resolves a lowercase JSON name.
     *
     * @throws IllegalArgumentException if the name is not a known variable type
     */
    public static VariableType fromJsonName(String name) {
        for (VariableType type : values()) {
            if (type.jsonName().equals(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown variable type: '" + name + "'");
    }
}
