package io.pricerule.core.engine;

import io.pricerule.core.error.DivisionByZeroException;
import io.pricerule.core.error.InvalidNumberException;
import io.pricerule.core.error.LimitExceededException;
import io.pricerule.core.error.MissingOperandException;
import io.pricerule.core.error.UnbalancedParenthesesException;
import io.pricerule.core.error.UnexpectedCharacterException;
import io.pricerule.core.error.UnknownVariableException;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Recursive-descent evaluator for the formula language: {@code + - * /}, unary signs,
 * parentheses, decimal numbers and variable references.
 *
 * <pre>
 * expr   := term (('+' | '-') term)*
 * term   := factor (('*' | '/') factor)*
 * factor := ('+' | '-') factor | '(' expr ')' | number | variable
 * </pre>
 *
 * <p>
 * Each call works on its own {@link Cursor}, so one instance can be shared across threads.
 * Parentheses and unary signs both count towards {@link EngineLimits#maxNestingDepth()}.
 */
public final class ArithmeticEvaluator {

    private final EngineLimits limits;

    public ArithmeticEvaluator(EngineLimits limits) {
        this.limits = Objects.requireNonNull(limits, "limits must not be null");
    }

    public ArithmeticEvaluator() {
        this(EngineLimits.DEFAULT);
    }

    /**
     * Evaluates {@code expression} against the given variable values.
     *
     * @param expression the arithmetic expression
     * @param variables  values of every variable the expression may reference
     * @return the finite result
     * @throws io.pricerule.core.error.RuleException if the expression is blank, malformed,
     *                                                divides by zero, refers to an unknown
     *                                                variable, or yields a non-finite number
     */
    public double evaluate(String expression, Map<String, Double> variables) {
        return evaluate(expression, variables, null);
    }

    /**
     * Evaluates {@code expression}, reporting every variable reference to {@code onVariable}
     * in the order it is read.
     */
    public double evaluate(String expression, Map<String, Double> variables, Consumer<String> onVariable) {
        Objects.requireNonNull(variables, "variables must not be null");
        if (expression == null || expression.isBlank()) {
            throw new MissingOperandException("Enter a formula before validating.");
        }
        if (expression.length() > limits.maxFormulaLength()) {
            throw new LimitExceededException(
                    "Formula exceeds maximum length of " + limits.maxFormulaLength() + " characters.",
                    limits.maxFormulaLength(),
                    limits.maxFormulaLength());
        }

        Cursor cursor = new Cursor(expression, variables, onVariable);
        double result = parseExpression(cursor);
        cursor.skipWhitespace();
        if (!cursor.atEnd()) {
            throw new UnexpectedCharacterException(cursor.peek(), cursor.pos);
        }
        if (!Double.isFinite(result)) {
            throw new InvalidNumberException("Expression evaluates to an invalid number.", null);
        }
        return result;
    }

    /**
     * Returns the keys {@code expression} refers to, in first-use order. Every key in
     * {@code declaredKeys} is bound to one while parsing, so a divisor that is a bare variable
     * never trips the zero check.
     *
     * @throws io.pricerule.core.error.RuleException if the expression is malformed or refers
     *                                                to a key outside {@code declaredKeys}
     */
    public Set<String> referencedVariables(String expression, Collection<String> declaredKeys) {
        Map<String, Double> ones = new HashMap<>();
        for (String key : declaredKeys) {
            ones.put(key, 1.0);
        }
        Set<String> seen = new LinkedHashSet<>();
        evaluate(expression, ones, seen::add);
        return seen;
    }

    private double parseExpression(Cursor cursor) {
        double value = parseTerm(cursor);
        while (true) {
            cursor.skipWhitespace();
            char c = cursor.peek();
            if (c == '+' || c == '-') {
                cursor.pos++;
                int operatorPos = cursor.pos - 1;
                double next = parseTerm(cursor);
                value = requireFinite(c == '+' ? value + next : value - next, operatorPos);
                continue;
            }
            return value;
        }
    }

    private double parseTerm(Cursor cursor) {
        double value = parseFactor(cursor);
        while (true) {
            cursor.skipWhitespace();
            char c = cursor.peek();
            if (c == '*' || c == '/') {
                int operatorPos = cursor.pos;
                cursor.pos++;
                double next = parseFactor(cursor);
                if (c == '/' && next == 0) {
                    throw new DivisionByZeroException(operatorPos);
                }
                value = requireFinite(c == '*' ? value * next : value / next, operatorPos);
                continue;
            }
            return value;
        }
    }

    private double parseFactor(Cursor cursor) {
        cursor.skipWhitespace();
        if (cursor.atEnd()) {
            throw new MissingOperandException("Unexpected end of expression.", cursor.pos);
        }
        char c = cursor.peek();

        if (c == '+' || c == '-') {
            cursor.pos++;
            cursor.enter();
            double value = parseFactor(cursor);
            cursor.exit();
            return c == '-' ? -value : value;
        }

        if (c == '(') {
            int openPos = cursor.pos;
            cursor.pos++;
            cursor.enter();
            double value = parseExpression(cursor);
            cursor.skipWhitespace();
            if (cursor.peek() != ')') {
                throw new UnbalancedParenthesesException("Expected closing parenthesis.", openPos);
            }
            cursor.pos++;
            cursor.exit();
            return value;
        }

        if (isDigit(c) || c == '.') {
            return parseNumber(cursor);
        }

        if (isIdentifierStart(c)) {
            return parseVariable(cursor);
        }

        throw new UnexpectedCharacterException(c, cursor.pos);
    }

    /** Overflow in any intermediate step fails at the operator that caused it. */
    private static double requireFinite(double value, int operatorPos) {
        if (!Double.isFinite(value)) {
            throw new InvalidNumberException("Expression evaluates to an invalid number.", operatorPos);
        }
        return value;
    }

    private static double parseNumber(Cursor cursor) {
        int start = cursor.pos;
        while (isDigit(cursor.peek())) {
            cursor.pos++;
        }
        if (cursor.peek() == '.') {
            cursor.pos++;
            while (isDigit(cursor.peek())) {
                cursor.pos++;
            }
        }
        String raw = cursor.text.substring(start, cursor.pos);
        if (raw.equals(".")) {
            throw new InvalidNumberException("Invalid number literal.", start);
        }
        double parsed = Double.parseDouble(raw);
        if (!Double.isFinite(parsed)) {
            throw new InvalidNumberException("Invalid number \"" + raw + "\".", start);
        }
        return parsed;
    }

    private static double parseVariable(Cursor cursor) {
        int start = cursor.pos;
        cursor.pos++;
        while (isIdentifierPart(cursor.peek())) {
            cursor.pos++;
        }
        String key = cursor.text.substring(start, cursor.pos);
        Double value = cursor.variables.get(key);
        if (value == null) {
            throw new UnknownVariableException(key, start);
        }
        if (cursor.onVariable != null) {
            cursor.onVariable.accept(key);
        }
        return value;
    }

    static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    static boolean isIdentifierStart(char c) {
        return c == '_' || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    /** Scan position and nesting depth for a single evaluation. */
    private final class Cursor {

        private static final char END = '\0';

        private final String text;
        private final Map<String, Double> variables;
        private final Consumer<String> onVariable;
        private int pos;
        private int depth;

        private Cursor(String text, Map<String, Double> variables, Consumer<String> onVariable) {
            this.text = text;
            this.variables = variables;
            this.onVariable = onVariable;
        }

        private boolean atEnd() {
            return pos >= text.length();
        }

        private char peek() {
            return atEnd() ? END : text.charAt(pos);
        }

        private void skipWhitespace() {
            while (!atEnd() && Character.isWhitespace(text.charAt(pos))) {
                pos++;
            }
        }

        private void enter() {
            depth++;
            if (depth > limits.maxNestingDepth()) {
                throw new LimitExceededException(
                        "Formula exceeds maximum nesting depth of " + limits.maxNestingDepth() + ".",
                        limits.maxNestingDepth(),
                        pos);
            }
        }

        private void exit() {
            depth--;
        }
    }
}
