package io.pricerule.core.error;

/**
 * Thrown when input exceeds a configured engine limit (text length, nesting depth or condition
 * count). Keeps hostile or runaway input from exhausting the call stack. URN:
 * {@code urn:price-rule:error:limit-exceeded}
 */
public final class LimitExceededException extends RuleSyntaxException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:price-rule:error:limit-exceeded";

    private final int limit;

    public LimitExceededException(String message, int limit, Integer position) {
        super(message, position);
        this.limit = limit;
    }

    /** The limit that was exceeded. */
    public int limit() {
        return limit;
    }

    @Override
    public String urn() {
        return URN;
    }
}
