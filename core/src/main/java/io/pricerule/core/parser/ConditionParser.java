package io.pricerule.core.parser;

import io.pricerule.core.engine.EngineLimits;
import io.pricerule.core.engine.TypeChecker;
import io.pricerule.core.error.LimitExceededException;
import io.pricerule.core.error.MissingComparatorException;
import io.pricerule.core.error.MissingOperandException;
import io.pricerule.core.model.Comparator;
import io.pricerule.core.model.Condition;
import io.pricerule.core.model.Definition;
import io.pricerule.core.model.Operand;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns condition text such as {@code NOT city = 'Manila'} into a type-checked
 * {@link Condition}.
 *
 * <p>
 * The first comparator outside quotes splits the text. At each position the two-character
 * symbols are tried before the one-character ones.
 */
public final class ConditionParser {

    private static final Pattern NOT_PREFIX = Pattern.compile("^not\\s+", Pattern.CASE_INSENSITIVE);

    private final OperandParser operandParser;
    private final EngineLimits limits;
    private final Supplier<String> idGenerator;

    /**
     * @param operandParser parser for each side
     * @param limits        engine limits; {@link EngineLimits#maxConditions()} caps
     *                      {@link #parseAll}
     * @param idGenerator   source of condition ids
     */
    public ConditionParser(OperandParser operandParser, EngineLimits limits, Supplier<String> idGenerator) {
        this.operandParser = Objects.requireNonNull(operandParser, "operandParser must not be null");
        this.limits = Objects.requireNonNull(limits, "limits must not be null");
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator must not be null");
    }

    /** Uses random UUIDs for condition ids. */
    public ConditionParser(OperandParser operandParser, EngineLimits limits) {
        this(operandParser, limits, () -> UUID.randomUUID().toString());
    }

    /**
     * Splits and parses a whole condition list.
     *
     * @throws LimitExceededException if there are more conditions than the engine allows
     */
    public List<Condition> parseAll(String conditionsText, Definition definition) {
        List<ConditionText> parts = ConditionSplitter.split(conditionsText);
        if (parts.size() > limits.maxConditions()) {
            throw new LimitExceededException(
                    "Conditions exceed maximum of " + limits.maxConditions() + ".", limits.maxConditions(), null);
        }
        List<Condition> conditions = new ArrayList<>(parts.size());
        for (ConditionText part : parts) {
            conditions.add(parse(part, definition));
        }
        return List.copyOf(conditions);
    }

    /** Parses and type-checks one condition. */
    public Condition parse(ConditionText part, Definition definition) {
        String text = part.text().trim();
        boolean negated = false;
        Matcher not = NOT_PREFIX.matcher(text);
        if (not.find()) {
            negated = true;
            text = text.substring(not.end());
        }

        int[] found = findComparator(text);
        if (found == null) {
            throw new MissingComparatorException(
                    "Condition \"" + part.text() + "\" needs a comparison operator (<, <=, >, >=, =, !=).");
        }
        Comparator comparator = Comparator.BY_SCAN_PRIORITY.get(found[1]);
        int at = found[0];
        String leftText = text.substring(0, at).trim();
        String rightText = text.substring(at + comparator.symbol().length()).trim();
        if (leftText.isEmpty()) {
            throw new MissingOperandException(
                    "Condition \"" + part.text() + "\" has nothing before \"" + comparator.symbol() + "\".", at);
        }
        if (rightText.isEmpty()) {
            throw new MissingOperandException(
                    "Condition \"" + part.text() + "\" has nothing after \"" + comparator.symbol() + "\".", at);
        }

        Operand left = operandParser.parse(leftText, definition);
        Operand right = operandParser.parse(rightText, definition);
        TypeChecker.check(left, right, definition);
        return new Condition(idGenerator.get(), part.connector(), negated, comparator, left, right);
    }

    /**
     * Returns {@code {index, priorityIndex}} of the first comparator outside quotes, or
     * {@code null}.
     */
    private static int[] findComparator(String text) {
        char quote = '\0';
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != '\0') {
                if (c == quote) {
                    quote = '\0';
                }
                continue;
            }
            if (QuoteAwareScanner.isQuote(c)) {
                quote = c;
                continue;
            }
            for (int p = 0; p < Comparator.BY_SCAN_PRIORITY.size(); p++) {
                if (text.startsWith(Comparator.BY_SCAN_PRIORITY.get(p).symbol(), i)) {
                    return new int[] {i, p};
                }
            }
        }
        return null;
    }
}
