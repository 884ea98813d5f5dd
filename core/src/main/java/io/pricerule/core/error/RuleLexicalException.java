package io.pricerule.core.error;

/** Lexical errors: input characters that cannot begin or complete a token. */
public abstract class RuleLexicalException extends RuleException {

    private static final long serialVersionUID = 1L;

    protected RuleLexicalException(String message, Integer position) {
        super(message, Category.LEXICAL, position);
    }

    protected RuleLexicalException(String message, Throwable cause, Integer position) {
        super(message, cause, Category.LEXICAL, position);
    }
}
