package io.pricerule.core.error;

/**
 * Thrown when a definition or rule breaks a structural invariant: duplicate or malformed
 * variable keys, misplaced connectors, an empty formula, removal of a variable still in use.
 * URN: {@code urn:price-rule:error:invalid-definition}
 */
public final class InvalidDefinitionException extends RuleSemanticException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:price-rule:error:invalid-definition";

    private final String path;

    /**
     * @param message human-readable description
     * @param path    location of the offending element, e.g. {@code variables[3].key}
     */
    public InvalidDefinitionException(String message, String path) {
        super(message, null);
        this.path = path;
    }

    public String path() {
        return path;
    }

    @Override
    public String urn() {
        return URN;
    }
}
