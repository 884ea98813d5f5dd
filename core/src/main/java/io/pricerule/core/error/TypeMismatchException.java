package io.pricerule.core.error;

/**
 * Thrown when the two sides of a comparison have incompatible types. URN:
 * {@code urn:price-rule:error:type-mismatch}
 */
public final class TypeMismatchException extends RuleSemanticException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:price-rule:error:type-mismatch";

    private final String subject;
    private final String expected;
    private final String actual;

    /**
     * @param subject  the offending variable key (or literal text when no variable is involved)
     * @param expected the kind(s) the subject accepts, e.g. {@code "date or datetime"}
     * @param actual   the kind found on the other side
     */
    public TypeMismatchException(String subject, String expected, String actual) {
        super(String.format("Type mismatch for \"%s\": expected %s, got %s.", subject, expected, actual), null);
        this.subject = subject;
        this.expected = expected;
        this.actual = actual;
    }

    public String subject() {
        return subject;
    }

    public String expected() {
        return expected;
    }

    public String actual() {
        return actual;
    }

    @Override
    public String urn() {
        return URN;
    }
}
