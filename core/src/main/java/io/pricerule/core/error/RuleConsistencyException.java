package io.pricerule.core.error;

/**
 * Consistency errors: every condition parses and type-checks, but a group of them can never be
 * satisfied or repeats another. Carries the variable key or clause signature at fault.
 */
public abstract class RuleConsistencyException extends RuleException {

    private static final long serialVersionUID = 1L;

    private final String subject;

    protected RuleConsistencyException(String message, String subject) {
        super(message, Category.CONSISTENCY, null);
        this.subject = subject;
    }

    /** The variable key or signature that triggered the error. */
    public String subject() {
        return subject;
    }
}
