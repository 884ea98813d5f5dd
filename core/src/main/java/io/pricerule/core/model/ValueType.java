package io.pricerule.core.model;

import java.util.Locale;

/** Kind of value carried by an {@link Operand.Literal}. */
public enum ValueType {
    NUMBER,
    TEXT,
    DATE,
    TIME,
    DATETIME;

    /** Lowercase name used in JSON, in function literals and in error messages. */
    public String jsonName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a lowercase JSON name.
     *
     * @throws IllegalArgumentException if the name is not a known value type
     */
    public static ValueType fromJsonName(String name) {
        for (ValueType type : values()) {
            if (type.jsonName().equals(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown value type: '" + name + "'");
    }
}
