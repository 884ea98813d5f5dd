package io.pricerule.core.error;

import io.pricerule.core.model.ValueType;

/**
 * Thrown when a {@code date(...)}, {@code time(...)} or {@code datetime(...)} literal does not
 * hold a real calendar date, clock time or ISO date-time. URN:
 * {@code urn:price-rule:error:invalid-literal}
 */
public final class InvalidLiteralException extends RuleSemanticException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:price-rule:error:invalid-literal";

    private final ValueType valueType;

    public InvalidLiteralException(String message, ValueType valueType) {
        super(message, null);
        this.valueType = valueType;
    }

    public InvalidLiteralException(String message, Throwable cause, ValueType valueType) {
        super(message, cause, null);
        this.valueType = valueType;
    }

    /** The literal kind that failed validation. */
    public ValueType valueType() {
        return valueType;
    }

    @Override
    public String urn() {
        return URN;
    }
}
