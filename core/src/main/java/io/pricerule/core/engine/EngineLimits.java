package io.pricerule.core.engine;

/**
 * Size and depth ceilings applied to every rule the engine reads. They turn runaway or hostile
 * input into a reportable {@link io.pricerule.core.error.LimitExceededException} instead of a
 * stack overflow.
 *
 * <p>
 * Immutable and thread-safe.
 *
 * @param maxFormulaLength maximum length of one arithmetic expression (default: 2000)
 * @param maxRuleLength    maximum length of raw rule text, all clauses included (default: 4000)
 * @param maxNestingDepth  maximum depth of parentheses and unary signs in one expression
 *                         (default: 64)
 * @param maxConditions    maximum number of conditions in one definition (default: 50)
 */
public record EngineLimits(int maxFormulaLength, int maxRuleLength, int maxNestingDepth, int maxConditions) {

    /** Default limits. */
    public static final EngineLimits DEFAULT = new EngineLimits(2000, 4000, 64, 50);

    public EngineLimits {
        requirePositive("maxFormulaLength", maxFormulaLength);
        requirePositive("maxRuleLength", maxRuleLength);
        requirePositive("maxNestingDepth", maxNestingDepth);
        requirePositive("maxConditions", maxConditions);
    }

    private static void requirePositive(String name, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got: " + value);
        }
    }
}
