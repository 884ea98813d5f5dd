package io.pricerule.core.model;

import java.util.Objects;

/**
 * A value reference inside a {@link Condition}: either a declared variable or a typed literal.
 *
 * <p>
 * Sealed: every consumer handles exactly the two variants below.
 */
public sealed interface Operand {

    /** A reference to a variable declared in the enclosing {@link Definition}. */
    record VariableRef(String key) implements Operand {
        public VariableRef {
            Objects.requireNonNull(key, "key must not be null");
            if (key.isBlank()) {
                throw new IllegalArgumentException("variable key must not be blank");
            }
        }
    }

    /**
     * A typed literal value.
     *
     * @param value     the literal text: a decimal number or arithmetic expression for
     *                  {@link ValueType#NUMBER}, the unquoted text for {@link ValueType#TEXT},
     *                  the normalized argument for date, time and datetime literals
     * @param valueType the literal kind
     */
    record Literal(String value, ValueType valueType) implements Operand {
        public Literal {
            Objects.requireNonNull(value, "value must not be null");
            Objects.requireNonNull(valueType, "valueType must not be null");
        }

        public static Literal number(String value) {
            return new Literal(value, ValueType.NUMBER);
        }

        public static Literal text(String value) {
            return new Literal(value, ValueType.TEXT);
        }
    }

    /** Creates a variable reference. */
    static Operand variable(String key) {
        return new VariableRef(key);
    }
}
