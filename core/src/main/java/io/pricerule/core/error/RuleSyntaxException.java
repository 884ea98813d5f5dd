package io.pricerule.core.error;

/** Syntax errors: recognisable tokens in an arrangement the grammar does not allow, and inputs over a configured size limit. */
public abstract class RuleSyntaxException extends RuleException {

    private static final long serialVersionUID = 1L;

    protected RuleSyntaxException(String message, Integer position) {
        super(message, Category.SYNTAX, position);
    }

    protected RuleSyntaxException(String message, Throwable cause, Integer position) {
        super(message, cause, Category.SYNTAX, position);
    }
}
