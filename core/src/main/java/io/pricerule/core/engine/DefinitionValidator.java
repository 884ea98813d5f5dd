package io.pricerule.core.engine;

import io.pricerule.core.error.InvalidDefinitionException;
import io.pricerule.core.error.InvalidLiteralException;
import io.pricerule.core.error.InvalidNumberException;
import io.pricerule.core.error.LimitExceededException;
import io.pricerule.core.error.UnknownVariableException;
import io.pricerule.core.model.Condition;
import io.pricerule.core.model.Definition;
import io.pricerule.core.model.Operand;
import io.pricerule.core.model.ReservedVariables;
import io.pricerule.core.model.Rule;
import io.pricerule.core.model.ValueType;
import io.pricerule.core.model.Variable;
import io.pricerule.core.parser.LiteralValidator;
import io.pricerule.core.parser.OperandParser;
import io.pricerule.core.parser.RuleTextParser;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Checks a whole {@link Definition} or {@link Rule}, typically one read back from storage,
 * against every structural and semantic rule the parser enforces on text.
 *
 * <p>
 * Stops at the first violation.
 */
public final class DefinitionValidator {

    /** Variable keys are lowercase snake_case identifiers. */
    public static final Pattern KEY_PATTERN = Pattern.compile("^[a-z_][a-z0-9_]*$");

    public static final int MAX_DESCRIPTION_LENGTH = 500;

    private final EngineLimits limits;
    private final ArithmeticEvaluator evaluator;

    public DefinitionValidator(EngineLimits limits, ArithmeticEvaluator evaluator) {
        this.limits = Objects.requireNonNull(limits, "limits must not be null");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
    }

    /** Checks the rule's name and description, then its definition. */
    public void validate(Rule rule) {
        if (rule.name() == null || rule.name().isBlank()) {
            throw new InvalidDefinitionException("Name is required.", "name");
        }
        if (rule.description() != null && rule.description().length() > MAX_DESCRIPTION_LENGTH) {
            throw new InvalidDefinitionException(
                    "Description must be at most " + MAX_DESCRIPTION_LENGTH + " characters.", "description");
        }
        validate(rule.definition());
    }

    /**
     * @throws io.pricerule.core.error.RuleException describing the first violation found
     */
    public void validate(Definition definition) {
        validateVariables(definition.variables());
        validateConditions(definition);
        validateFormula(definition);
    }

    /**
     * Checks a definition that rule text will be parsed against. Same checks as
     * {@link #validate(Definition)}, except that a blank formula is allowed.
     */
    public void validateContext(Definition definition) {
        validateVariables(definition.variables());
        validateConditions(definition);
        if (!definition.formula().isBlank()) {
            validateFormula(definition);
        }
    }

    private static void validateVariables(List<Variable> variables) {
        Set<String> keys = new HashSet<>();
        for (int i = 0; i < variables.size(); i++) {
            Variable variable = variables.get(i);
            String path = "variables[" + i + "]";
            if (!KEY_PATTERN.matcher(variable.key()).matches()) {
                throw new InvalidDefinitionException(
                        "Variable key \"" + variable.key()
                                + "\" must start with a lowercase letter or underscore and contain only"
                                + " lowercase letters, digits and underscores.",
                        path + ".key");
            }
            if (ReservedVariables.isKeyword(variable.key())) {
                throw new InvalidDefinitionException(
                        "Variable key \"" + variable.key() + "\" is a rule keyword.", path + ".key");
            }
            if (!keys.add(variable.key())) {
                throw new InvalidDefinitionException(
                        "Duplicate variable key \"" + variable.key() + "\".", path + ".key");
            }
            if (variable.label().isBlank()) {
                throw new InvalidDefinitionException(
                        "Variable \"" + variable.key() + "\" needs a label.", path + ".label");
            }
            if (variable.userInput() && !variable.type().supportsUserInput()) {
                throw new InvalidDefinitionException(
                        "Only number and text variables can be user input; \"" + variable.key() + "\" is a "
                                + variable.type().jsonName() + ".",
                        path + ".userInput");
            }
        }
    }

    private void validateConditions(Definition definition) {
        List<Condition> conditions = definition.conditions();
        if (conditions.size() > limits.maxConditions()) {
            throw new LimitExceededException(
                    "Conditions exceed maximum of " + limits.maxConditions() + ".", limits.maxConditions(), null);
        }
        Map<String, Double> zeros = OperandParser.zeroFilledNumbers(definition);
        for (int i = 0; i < conditions.size(); i++) {
            Condition condition = conditions.get(i);
            String path = "conditions[" + i + "]";
            if (i == 0 && condition.connector() != null) {
                throw new InvalidDefinitionException(
                        "The first condition must not have a connector.", path + ".connector");
            }
            if (i > 0 && condition.connector() == null) {
                throw new InvalidDefinitionException(
                        "Condition " + (i + 1) + " needs AND or OR to join the previous one.", path + ".connector");
            }
            validateOperand(condition.left(), definition, zeros);
            validateOperand(condition.right(), definition, zeros);
            TypeChecker.check(condition.left(), condition.right(), definition);
        }
        CollisionDetector.check(conditions);
    }

    private void validateOperand(Operand operand, Definition definition, Map<String, Double> zeros) {
        if (operand instanceof Operand.VariableRef ref) {
            if (!definition.hasVariable(ref.key())) {
                throw new UnknownVariableException(ref.key(), null);
            }
            return;
        }
        Operand.Literal literal = (Operand.Literal) operand;
        switch (literal.valueType()) {
            case TEXT -> {
                if (literal.value().indexOf('\'') >= 0 && literal.value().indexOf('"') >= 0) {
                    throw new InvalidLiteralException(
                            "Text \"" + literal.value() + "\" cannot hold both quote characters.", ValueType.TEXT);
                }
            }
            case NUMBER -> {
                if (literal.value().isBlank()) {
                    throw new InvalidNumberException("Invalid number literal.", null);
                }
                evaluator.evaluate(literal.value(), zeros);
            }
            case DATE -> LiteralValidator.validateDate(literal.value());
            case TIME -> {
                if (!literal.value().equals(LiteralValidator.normalizeTime(literal.value(), null))) {
                    throw new InvalidLiteralException(
                            "Time literal \"" + literal.value() + "\" must be written as HH:mm or HH:mm:ss.",
                            ValueType.TIME);
                }
            }
            case DATETIME -> LiteralValidator.validateDatetime(literal.value());
        }
    }

    private void validateFormula(Definition definition) {
        if (definition.formula().isBlank()) {
            throw new InvalidDefinitionException("Add a formula to determine the price action.", "formula");
        }
        RuleTextParser.Branches branches = RuleTextParser.splitBranches(definition.formula());
        if (branches.elseFormula() != null && definition.conditions().isEmpty()) {
            throw new InvalidDefinitionException("ELSE needs at least one condition to fall back from.", "formula");
        }
        Map<String, Double> zeros = OperandParser.zeroFilledNumbers(definition);
        evaluator.evaluate(branches.thenFormula(), zeros);
        if (branches.elseFormula() != null) {
            evaluator.evaluate(branches.elseFormula(), zeros);
        }
    }
}
