package io.pricerule.core.error;

/** Thrown when a condition has no comparison operator. URN: {@code urn:price-rule:error:missing-comparator} */
public final class MissingComparatorException extends RuleSyntaxException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:price-rule:error:missing-comparator";

    public MissingComparatorException(String message) {
        super(message, null);
    }

    @Override
    public String urn() {
        return URN;
    }
}
