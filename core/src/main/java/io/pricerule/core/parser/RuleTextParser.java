package io.pricerule.core.parser;

import io.pricerule.core.engine.ArithmeticEvaluator;
import io.pricerule.core.engine.EngineLimits;
import io.pricerule.core.error.LimitExceededException;
import io.pricerule.core.error.MissingOperandException;
import io.pricerule.core.error.MissingThenException;
import io.pricerule.core.model.Condition;
import io.pricerule.core.model.Definition;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parses a single clause: either {@code IF <conditions> THEN <formula> [ELSE <formula>]} or a
 * bare formula.
 *
 * <p>
 * {@code IF}, {@code THEN} and {@code ELSE} match case-insensitively as whole words outside
 * quotes. Both formula branches are checked with every number variable set to zero.
 */
public final class RuleTextParser {

    private final ArithmeticEvaluator evaluator;
    private final ConditionParser conditionParser;
    private final EngineLimits limits;

    public RuleTextParser(ArithmeticEvaluator evaluator, ConditionParser conditionParser, EngineLimits limits) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
        this.conditionParser = Objects.requireNonNull(conditionParser, "conditionParser must not be null");
        this.limits = Objects.requireNonNull(limits, "limits must not be null");
    }

    /**
     * THEN and optional ELSE parts of a stored formula.
     *
     * @param thenFormula applies when the conditions hold (or always, without conditions)
     * @param elseFormula applies otherwise, {@code null} when absent
     */
    public record Branches(String thenFormula, String elseFormula) {

        /** The stored form: {@code <then>} or {@code <then> ELSE <else>}. */
        public String formula() {
            return elseFormula == null ? thenFormula : thenFormula + " ELSE " + elseFormula;
        }
    }

    /**
     * Parses {@code text} against the variables of {@code current}.
     *
     * @return a copy of {@code current} with the parsed conditions and formula
     * @throws io.pricerule.core.error.RuleException on any lexical, syntax or semantic error
     */
    public Definition parse(String text, Definition current) {
        Objects.requireNonNull(current, "current must not be null");
        if (text == null || text.isBlank()) {
            throw new MissingOperandException("Enter a formula before validating.");
        }
        String trimmed = text.trim();
        if (trimmed.length() > limits.maxRuleLength()) {
            throw new LimitExceededException(
                    "Rule exceeds maximum length of " + limits.maxRuleLength() + " characters.",
                    limits.maxRuleLength(),
                    limits.maxRuleLength());
        }

        if (!QuoteAwareScanner.isKeywordAt(trimmed, "if", 0)) {
            Branches branches = new Branches(trimmed, null);
            validateFormula(branches, current);
            return current.withConditions(List.of()).withFormula(branches.formula());
        }

        int thenAt = QuoteAwareScanner.indexOfKeyword(trimmed, "then", 2);
        if (thenAt < 0) {
            throw new MissingThenException("A rule that starts with IF needs a THEN followed by a formula.");
        }
        String conditionsText = trimmed.substring(2, thenAt);
        if (conditionsText.isBlank()) {
            throw new MissingOperandException("Add at least one condition between IF and THEN.", 2);
        }
        Branches branches = splitBranches(trimmed.substring(thenAt + 4));
        List<Condition> conditions = conditionParser.parseAll(conditionsText, current);
        validateFormula(branches, current);
        return current.withConditions(conditions).withFormula(branches.formula());
    }

    /**
     * Splits a formula at its first top-level {@code ELSE}.
     *
     * @throws MissingOperandException if either side of the split is empty
     */
    public static Branches splitBranches(String formula) {
        String trimmed = formula == null ? "" : formula.trim();
        int elseAt = QuoteAwareScanner.indexOfKeyword(trimmed, "else", 0);
        if (elseAt < 0) {
            if (trimmed.isEmpty()) {
                throw new MissingOperandException("Add a formula to determine the price action.");
            }
            return new Branches(trimmed, null);
        }
        String thenFormula = trimmed.substring(0, elseAt).trim();
        String elseFormula = trimmed.substring(elseAt + 4).trim();
        if (thenFormula.isEmpty()) {
            throw new MissingOperandException("Add a formula before ELSE.", elseAt);
        }
        if (elseFormula.isEmpty()) {
            throw new MissingOperandException("Add a formula after ELSE.", elseAt + 4);
        }
        return new Branches(thenFormula, elseFormula);
    }

    /** Evaluates every branch with number variables set to zero. */
    public void validateFormula(Branches branches, Definition definition) {
        Map<String, Double> zeros = OperandParser.zeroFilledNumbers(definition);
        evaluator.evaluate(branches.thenFormula(), zeros);
        if (branches.elseFormula() != null) {
            evaluator.evaluate(branches.elseFormula(), zeros);
        }
    }
}
