package io.pricerule.core.error;

/**
 * Thrown when the scanner meets a character that cannot continue the current expression,
 * including any input left over after a complete parse. URN:
 * {@code urn:price-rule:error:unexpected-character}
 */
public final class UnexpectedCharacterException extends RuleLexicalException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:price-rule:error:unexpected-character";

    public UnexpectedCharacterException(char found, int position) {
        super("Unexpected character \"" + found + "\".", position);
    }

    public UnexpectedCharacterException(String message, Integer position) {
        super(message, position);
    }

    @Override
    public String urn() {
        return URN;
    }
}
