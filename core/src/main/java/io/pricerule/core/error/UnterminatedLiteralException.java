package io.pricerule.core.error;

/** Thrown when a quoted text opens but never closes. URN: {@code urn:price-rule:error:unterminated-literal} */
public final class UnterminatedLiteralException extends RuleLexicalException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:price-rule:error:unterminated-literal";

    public UnterminatedLiteralException(String message, Integer position) {
        super(message, position);
    }

    @Override
    public String urn() {
        return URN;
    }
}
