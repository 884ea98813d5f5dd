package io.pricerule.core.error;

/**
 * Abstract base for every rule-language error. Never thrown directly; the concrete classes sit
 * under one of four category tiers:
 *
 * <ul>
 *   <li>{@link RuleLexicalException}: characters that cannot start any token.
 *   <li>{@link RuleSyntaxException}: tokens in an impossible arrangement.
 *   <li>{@link RuleSemanticException}: well-formed text that refers to or computes something
 *       invalid.
 *   <li>{@link RuleConsistencyException}: valid conditions that cannot hold together.
 * </ul>
 *
 * <p>
 * Every error is terminal for the validation pass that raised it. The message is written for
 * the partner editing the rule and is shown verbatim.
 */
public abstract class RuleException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Error family, used by callers that group or style messages. */
    public enum Category {
        LEXICAL,
        SYNTAX,
        SEMANTIC,
        CONSISTENCY
    }

    private final Category category;
    private final Integer position;

    protected RuleException(String message, Category category, Integer position) {
        super(message);
        this.category = category;
        this.position = position;
    }

    protected RuleException(String message, Throwable cause, Category category, Integer position) {
        super(message, cause);
        this.category = category;
        this.position = position;
    }

    public Category category() {
        return category;
    }

    /** Zero-based offset into the scanned text, or {@code null} when not tied to a position. */
    public Integer position() {
        return position;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** Stable URN identifying the error type, e.g. {@code urn:price-rule:error:type-mismatch}. */
    public abstract String urn();
}
