package io.pricerule.core.error;

/**
 * Thrown when the constraints on one variable within an AND-group admit no value, e.g.
 * {@code booking_hours > 10 AND booking_hours < 5}. URN:
 * {@code urn:price-rule:error:conflicting-conditions}
 */
public final class ConflictingConditionsException extends RuleConsistencyException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:price-rule:error:conflicting-conditions";

    public ConflictingConditionsException(String variableKey) {
        super("Conditions on \"" + variableKey + "\" contradict each other and can never all be true.", variableKey);
    }

    public String variableKey() {
        return subject();
    }

    @Override
    public String urn() {
        return URN;
    }
}
