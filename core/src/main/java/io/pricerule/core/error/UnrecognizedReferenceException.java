package io.pricerule.core.error;

/** Thrown when an operand is none of: number, quoted text, typed literal, expression, declared variable. */
public final class UnrecognizedReferenceException extends RuleSemanticException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:price-rule:error:unrecognized-reference";

    private final String token;

    public UnrecognizedReferenceException(String token) {
        super(
                "Unrecognized reference \"" + token + "\". Use a declared variable, a number, quoted text,"
                        + " or date(), time(), datetime().",
                null);
        this.token = token;
    }

    public String token() {
        return token;
    }

    @Override
    public String urn() {
        return URN;
    }
}
