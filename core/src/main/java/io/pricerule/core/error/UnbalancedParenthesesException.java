package io.pricerule.core.error;

/** Thrown when an opening parenthesis has no matching close. URN: {@code urn:price-rule:error:unbalanced-parentheses} */
public final class UnbalancedParenthesesException extends RuleSyntaxException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:price-rule:error:unbalanced-parentheses";

    public UnbalancedParenthesesException(String message, Integer position) {
        super(message, position);
    }

    @Override
    public String urn() {
        return URN;
    }
}
