package io.pricerule.core.error;

/** Semantic errors: well-formed text that names something undeclared, mixes incompatible types or computes an invalid value. */
public abstract class RuleSemanticException extends RuleException {

    private static final long serialVersionUID = 1L;

    protected RuleSemanticException(String message, Integer position) {
        super(message, Category.SEMANTIC, position);
    }

    protected RuleSemanticException(String message, Throwable cause, Integer position) {
        super(message, cause, Category.SEMANTIC, position);
    }
}
