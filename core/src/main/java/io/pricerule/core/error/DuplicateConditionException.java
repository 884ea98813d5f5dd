package io.pricerule.core.error;

/**
 * Thrown when a condition repeats another in the same AND-group, or two clauses carry the same
 * canonical condition signature. URN: {@code urn:price-rule:error:duplicate-condition}
 */
public final class DuplicateConditionException extends RuleConsistencyException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:price-rule:error:duplicate-condition";

    public DuplicateConditionException(String message, String signature) {
        super(message, signature);
    }

    @Override
    public String urn() {
        return URN;
    }
}
