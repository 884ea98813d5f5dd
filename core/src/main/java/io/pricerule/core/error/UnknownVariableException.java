package io.pricerule.core.error;

/**
 * Thrown when an expression or condition refers to a variable that is not declared (or, inside
 * a formula, not numeric). URN: {@code urn:price-rule:error:unknown-variable}
 */
public final class UnknownVariableException extends RuleSemanticException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:price-rule:error:unknown-variable";

    private final String variableKey;

    public UnknownVariableException(String variableKey, Integer position) {
        super("Unknown variable \"" + variableKey + "\".", position);
        this.variableKey = variableKey;
    }

    public String variableKey() {
        return variableKey;
    }

    @Override
    public String urn() {
        return URN;
    }
}
