package io.pricerule.core.parser;

import io.pricerule.core.engine.ArithmeticEvaluator;
import io.pricerule.core.error.InvalidLiteralException;
import io.pricerule.core.error.InvalidNumberException;
import io.pricerule.core.error.MissingOperandException;
import io.pricerule.core.error.UnrecognizedReferenceException;
import io.pricerule.core.error.UnterminatedLiteralException;
import io.pricerule.core.model.Definition;
import io.pricerule.core.model.Operand;
import io.pricerule.core.model.ValueType;
import io.pricerule.core.model.Variable;
import io.pricerule.core.model.VariableType;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies one side of a comparison. Classifiers run in a fixed order and the first match
 * wins:
 *
 * <ol>
 *   <li>number: {@code 42}, {@code -3.5}
 *   <li>quoted text: {@code 'Manila'} or {@code "Manila"}
 *   <li>typed literal: {@code date('2024-01-31')}, {@code time('9:30', 'PM')},
 *       {@code datetime('2024-01-31T09:30:00Z')}
 *   <li>arithmetic over number variables: {@code booking_hours * 2}
 *   <li>declared variable: {@code booking_hours}
 * </ol>
 *
 * <p>
 * Thread-safe: holds only the shared evaluator.
 */
public final class OperandParser {

    private static final Pattern NUMBER_PATTERN = Pattern.compile("^[+-]?\\d+(\\.\\d+)?$");
    private static final Pattern FUNCTION_PATTERN =
            Pattern.compile("^([A-Za-z_][A-Za-z0-9_]*)\\s*\\((.*)\\)$", Pattern.DOTALL);
    private static final Pattern IDENTIFIER_PATTERN = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");
    private static final String EXPRESSION_CHARS = "+-*/()";

    private final ArithmeticEvaluator evaluator;

    public OperandParser(ArithmeticEvaluator evaluator) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
    }

    /**
     * Parses {@code token} against the variables declared in {@code definition}.
     *
     * @throws io.pricerule.core.error.RuleException if the token matches no classifier or a
     *                                                matching classifier rejects it
     */
    public Operand parse(String token, Definition definition) {
        String text = token == null ? "" : token.trim();
        if (text.isEmpty()) {
            throw new MissingOperandException("Operand is empty.");
        }

        if (NUMBER_PATTERN.matcher(text).matches()) {
            if (!Double.isFinite(Double.parseDouble(text))) {
                throw new InvalidNumberException("Invalid number \"" + text + "\".", 0);
            }
            return Operand.Literal.number(text);
        }

        if (QuoteAwareScanner.isQuote(text.charAt(0))) {
            int close = text.indexOf(text.charAt(0), 1);
            if (close < 0) {
                throw new UnterminatedLiteralException("Text starting with " + text.charAt(0) + " is never closed.", 0);
            }
            if (close == text.length() - 1) {
                return Operand.Literal.text(text.substring(1, close));
            }
        }

        Matcher function = FUNCTION_PATTERN.matcher(text);
        if (function.matches()) {
            return parseFunction(text, function.group(1), function.group(2));
        }

        if (containsExpressionChar(text)) {
            evaluator.evaluate(text, zeroFilledNumbers(definition));
            return Operand.Literal.number(text);
        }

        if (IDENTIFIER_PATTERN.matcher(text).matches() && definition.hasVariable(text)) {
            return Operand.variable(text);
        }

        throw new UnrecognizedReferenceException(text);
    }

    /** Number variables bound to zero; used to check an expression's shape, not its value. */
    public static Map<String, Double> zeroFilledNumbers(Definition definition) {
        Map<String, Double> values = new HashMap<>();
        for (Variable variable : definition.variables()) {
            if (variable.type() == VariableType.NUMBER) {
                values.put(variable.key(), 0.0);
            }
        }
        return values;
    }

    private static Operand parseFunction(String token, String name, String rawArgs) {
        List<String> args = quotedArguments(token, rawArgs);
        switch (name.toLowerCase(Locale.ROOT)) {
            case "date" -> {
                requireArity(token, ValueType.DATE, args, 1, 1);
                return new Operand.Literal(LiteralValidator.validateDate(args.get(0)), ValueType.DATE);
            }
            case "time" -> {
                requireArity(token, ValueType.TIME, args, 1, 2);
                String meridiem = args.size() == 2 ? args.get(1) : null;
                return new Operand.Literal(LiteralValidator.normalizeTime(args.get(0), meridiem), ValueType.TIME);
            }
            case "datetime" -> {
                requireArity(token, ValueType.DATETIME, args, 1, 1);
                return new Operand.Literal(LiteralValidator.validateDatetime(args.get(0)), ValueType.DATETIME);
            }
            default -> throw new UnrecognizedReferenceException(token);
        }
    }

    /**
     * Splits a function argument list on commas outside quotes. Returns {@code null} entries for
     * arguments that are not a single quoted string.
     */
    private static List<String> quotedArguments(String token, String rawArgs) {
        List<String> args = new ArrayList<>();
        if (rawArgs.isBlank()) {
            return args;
        }
        QuoteAwareScanner.requireClosedQuotes(rawArgs);
        char quote = '\0';
        int start = 0;
        for (int i = 0; i <= rawArgs.length(); i++) {
            char c = i < rawArgs.length() ? rawArgs.charAt(i) : ',';
            if (quote != '\0') {
                if (c == quote) {
                    quote = '\0';
                }
            } else if (QuoteAwareScanner.isQuote(c)) {
                quote = c;
            } else if (c == ',') {
                args.add(unquote(rawArgs.substring(start, i).trim()));
                start = i + 1;
            }
        }
        return args;
    }

    private static String unquote(String arg) {
        if (arg.length() >= 2
                && QuoteAwareScanner.isQuote(arg.charAt(0))
                && arg.charAt(arg.length() - 1) == arg.charAt(0)) {
            return arg.substring(1, arg.length() - 1);
        }
        return null;
    }

    private static void requireArity(String token, ValueType type, List<String> args, int min, int max) {
        if (args.size() < min || args.size() > max || args.contains(null)) {
            String expected = min == max ? "one quoted argument" : "one or two quoted arguments";
            throw new InvalidLiteralException(
                    "Invalid " + type.jsonName() + " literal " + token + ": " + type.jsonName() + "() expects "
                            + expected + ".",
                    type);
        }
    }

    private static boolean containsExpressionChar(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (EXPRESSION_CHARS.indexOf(text.charAt(i)) >= 0) {
                return true;
            }
        }
        return false;
    }
}
