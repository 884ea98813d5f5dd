package io.pricerule.core.error;

/** Thrown when rule text opens with {@code IF} but has no {@code THEN}. URN: {@code urn:price-rule:error:missing-then} */
public final class MissingThenException extends RuleSyntaxException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:price-rule:error:missing-then";

    public MissingThenException(String message) {
        super(message, null);
    }

    @Override
    public String urn() {
        return URN;
    }
}
