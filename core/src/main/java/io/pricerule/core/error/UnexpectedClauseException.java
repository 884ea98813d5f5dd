package io.pricerule.core.error;

/**
 * Thrown when text holding several {@code IF} clauses is applied where exactly one is allowed.
 * URN: {@code urn:price-rule:error:unexpected-clause}
 */
public final class UnexpectedClauseException extends RuleSyntaxException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:price-rule:error:unexpected-clause";

    public UnexpectedClauseException(String message) {
        super(message, null);
    }

    @Override
    public String urn() {
        return URN;
    }
}
