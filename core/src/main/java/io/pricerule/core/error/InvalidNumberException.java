package io.pricerule.core.error;

/** Thrown when a number literal or a computed result is not finite. URN: {@code urn:price-rule:error:invalid-number} */
public final class InvalidNumberException extends RuleSemanticException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:price-rule:error:invalid-number";

    public InvalidNumberException(String message, Integer position) {
        super(message, position);
    }

    @Override
    public String urn() {
        return URN;
    }
}
