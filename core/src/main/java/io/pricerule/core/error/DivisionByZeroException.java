package io.pricerule.core.error;

/** URN: {@code urn:price-rule:error:division-by-zero} */
public final class DivisionByZeroException extends RuleSemanticException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:price-rule:error:division-by-zero";

    public DivisionByZeroException(Integer position) {
        super("Division by zero.", position);
    }

    @Override
    public String urn() {
        return URN;
    }
}
