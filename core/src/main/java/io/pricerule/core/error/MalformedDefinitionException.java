package io.pricerule.core.error;

/** Thrown when persisted definition JSON cannot be read or violates its schema. */
public final class MalformedDefinitionException extends RuleSyntaxException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:price-rule:error:malformed-definition";

    public MalformedDefinitionException(String message) {
        super(message, null);
    }

    public MalformedDefinitionException(String message, Throwable cause) {
        super(message, cause, null);
    }

    @Override
    public String urn() {
        return URN;
    }
}
