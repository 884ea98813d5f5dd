package io.pricerule.core.model;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Variables every fresh {@link Definition} starts with. Their keys can never be removed.
 *
 * <p>
 * Also holds the rule-language keywords, which no variable key may spell.
 */
public final class ReservedVariables {

    public static final String INPUT_TEXT = "input_text";
    public static final String BOOKING_HOURS = "booking_hours";
    public static final String CURRENT_DATE = "date";
    public static final String CURRENT_TIME = "time";

    /** The reserved variables, in declaration order. */
    public static final List<Variable> ALL = List.of(
            new Variable(INPUT_TEXT, "Input text", VariableType.TEXT, "", false),
            new Variable(BOOKING_HOURS, "Booking hours", VariableType.NUMBER, "1", false),
            Variable.of(CURRENT_DATE, "Current date", VariableType.DATE),
            Variable.of(CURRENT_TIME, "Current time", VariableType.TIME));

    /** Keys of {@link #ALL}. */
    public static final Set<String> KEYS =
            ALL.stream().map(Variable::key).collect(Collectors.toUnmodifiableSet());

    /** Rule-language keywords in lowercase; matched case-insensitively in rule text. */
    public static final Set<String> KEYWORDS = Set.of("if", "then", "else", "and", "or", "not");

    private ReservedVariables() {}

    public static boolean isReserved(String key) {
        return KEYS.contains(key);
    }

    public static boolean isKeyword(String key) {
        return key != null && KEYWORDS.contains(key.toLowerCase(Locale.ROOT));
    }
}
