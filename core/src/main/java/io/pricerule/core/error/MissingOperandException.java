package io.pricerule.core.error;

/**
 * Thrown when a required piece of text is empty: a side of a comparison, a clause between two
 * connectors, a formula branch, or the end of an arithmetic expression. URN:
 * {@code urn:price-rule:error:missing-operand}
 */
public final class MissingOperandException extends RuleSyntaxException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:price-rule:error:missing-operand";

    public MissingOperandException(String message) {
        super(message, null);
    }

    public MissingOperandException(String message, Integer position) {
        super(message, position);
    }

    @Override
    public String urn() {
        return URN;
    }
}
