package io.pricerule.core.engine;

import io.pricerule.core.error.LimitExceededException;
import io.pricerule.core.error.RuleException;
import io.pricerule.core.error.UnexpectedClauseException;
import io.pricerule.core.format.CanonicalSerializer;
import io.pricerule.core.model.Definition;
import io.pricerule.core.model.ParsedClause;
import io.pricerule.core.model.Rule;
import io.pricerule.core.parser.ClauseSplitter;
import io.pricerule.core.parser.ClauseText;
import io.pricerule.core.parser.ConditionParser;
import io.pricerule.core.parser.OperandParser;
import io.pricerule.core.parser.RuleTextParser;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the rule language: parses rule text into a {@link Definition}, checks
 * persisted definitions and renders them back to text.
 *
 * <p>
 * Parsing runs the full pipeline: clause split, IF/THEN/ELSE split, condition split, operand
 * classification, type check, collision check per clause, and a duplicate check across
 * clauses. Nothing is partially applied; on any {@link RuleException} the caller keeps its
 * previous definition.
 *
 * <p>
 * Thread-safe: holds only immutable collaborators. Intended to be called once per keystroke,
 * so rejections are logged at DEBUG.
 */
public final class RuleEngine {

    private static final Logger LOG = LoggerFactory.getLogger(RuleEngine.class);

    private final EngineLimits limits;
    private final ArithmeticEvaluator evaluator;
    private final RuleTextParser ruleTextParser;
    private final DefinitionValidator validator;
    private final DefinitionEditor editor;

    /**
     * @param limits      size and depth ceilings
     * @param idGenerator source of ids for parsed conditions
     */
    public RuleEngine(EngineLimits limits, Supplier<String> idGenerator) {
        this.limits = Objects.requireNonNull(limits, "limits must not be null");
        this.evaluator = new ArithmeticEvaluator(limits);
        ConditionParser conditionParser = new ConditionParser(new OperandParser(evaluator), limits, idGenerator);
        this.ruleTextParser = new RuleTextParser(evaluator, conditionParser, limits);
        this.validator = new DefinitionValidator(limits, evaluator);
        this.editor = new DefinitionEditor(evaluator);
    }

    /** Random UUID condition ids. */
    public RuleEngine(EngineLimits limits) {
        this(limits, () -> UUID.randomUUID().toString());
    }

    /** Default limits, random UUID condition ids. */
    public RuleEngine() {
        this(EngineLimits.DEFAULT);
    }

    public EngineLimits limits() {
        return limits;
    }

    /**
     * Parses single-clause rule text against the variables of {@code current}.
     *
     * @return a new definition holding the parsed conditions and formula
     * @throws UnexpectedClauseException if the text holds more than one clause
     * @throws RuleException             on any other error
     */
    public Definition parse(String ruleText, Definition current) {
        List<ParsedClause> clauses = parseClauses(ruleText, current);
        if (clauses.size() > 1) {
            UnexpectedClauseException e = new UnexpectedClauseException(
                    "Expected a single IF...THEN clause, found " + clauses.size() + ".");
            logRejection(e);
            throw e;
        }
        return clauses.get(0).definition();
    }

    /**
     * Parses rule text that may hold several clauses joined by {@code AND IF} or {@code OR IF}.
     * Each clause shares the variables of {@code current}.
     *
     * @throws RuleException if any clause is invalid or two clauses repeat the same conditions
     */
    public List<ParsedClause> parseClauses(String ruleText, Definition current) {
        Objects.requireNonNull(current, "current must not be null");
        try {
            if (ruleText != null && ruleText.length() > limits.maxRuleLength()) {
                throw new LimitExceededException(
                        "Rule exceeds maximum length of " + limits.maxRuleLength() + " characters.",
                        limits.maxRuleLength(),
                        limits.maxRuleLength());
            }
            List<ParsedClause> clauses = new ArrayList<>();
            for (ClauseText clause : ClauseSplitter.split(ruleText)) {
                Definition parsed = ruleTextParser.parse(clause.text(), current);
                CollisionDetector.check(parsed.conditions());
                clauses.add(new ParsedClause(clause.connector(), parsed));
            }
            DuplicateClauseDetector.check(clauses);
            LOG.debug(
                    "Rule accepted: clauses={}, conditions={}",
                    clauses.size(),
                    clauses.stream()
                            .mapToInt(c -> c.definition().conditions().size())
                            .sum());
            return List.copyOf(clauses);
        } catch (RuleException e) {
            logRejection(e);
            throw e;
        }
    }

    /** Renders a single-clause definition as rule text. */
    public String serialize(Definition definition) {
        return CanonicalSerializer.serialize(definition);
    }

    /** Renders parsed clauses as one rule text. */
    public String serialize(List<ParsedClause> clauses) {
        return CanonicalSerializer.serializeClauses(clauses);
    }

    /**
     * Checks a definition read from storage.
     *
     * @throws RuleException describing the first violation
     */
    public void validate(Definition definition) {
        try {
            validator.validate(definition);
        } catch (RuleException e) {
            logRejection(e);
            throw e;
        }
    }

    /**
     * Checks a definition before rule text is parsed against it; its formula may still be
     * blank.
     *
     * @throws RuleException describing the first violation
     */
    public void validateContext(Definition definition) {
        try {
            validator.validateContext(definition);
        } catch (RuleException e) {
            logRejection(e);
            throw e;
        }
    }

    /** Checks a rule's name, description and definition. */
    public void validate(Rule rule) {
        try {
            validator.validate(rule);
        } catch (RuleException e) {
            logRejection(e);
            throw e;
        }
    }

    /** Evaluates a formula branch with caller-supplied variable values. */
    public double evaluate(String expression, Map<String, Double> variables) {
        return evaluator.evaluate(expression, variables);
    }

    /** Keys referenced by the definition's conditions and formula. */
    public Set<String> usedVariables(Definition definition) {
        return editor.usedVariables(definition);
    }

    /** Authoring edits sharing this engine's evaluator. */
    public DefinitionEditor editor() {
        return editor;
    }

    private static void logRejection(RuleException e) {
        LOG.debug("Rule rejected: type={}, category={}, detail={}", e.urn(), e.category(), e.getMessage());
    }
}
