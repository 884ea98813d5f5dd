package io.pricerule.core.parser;

import io.pricerule.core.error.MissingOperandException;
import io.pricerule.core.model.Connector;
import java.util.ArrayList;
import java.util.List;

/**
 * Cuts the text between {@code IF} and {@code THEN} into single conditions at every top-level
 * {@code AND} or {@code OR}.
 *
 * <p>
 * A connector only counts when it is a whole word outside quotes, so {@code brand = 'Rock and
 * Roll'} and {@code orders > 1} stay intact.
 *
 * <p>
 * Thread-safe and stateless: all methods are static.
 */
public final class ConditionSplitter {

    private ConditionSplitter() {}

    /**
     * Splits {@code text} into conditions.
     *
     * @return conditions in source order; the first one has no connector
     * @throws MissingOperandException if the text is blank or a connector has nothing on one side
     * @throws io.pricerule.core.error.UnterminatedLiteralException if a quote is never closed
     */
    public static List<ConditionText> split(String text) {
        if (text == null || text.isBlank()) {
            throw new MissingOperandException("Enter at least one condition.");
        }
        QuoteAwareScanner.requireClosedQuotes(text);

        List<ConditionText> conditions = new ArrayList<>();
        Connector pending = null;
        int start = 0;
        int i = 0;
        while (i < text.length()) {
            int andAt = QuoteAwareScanner.indexOfKeyword(text, "and", i);
            int orAt = QuoteAwareScanner.indexOfKeyword(text, "or", i);
            int next = nearest(andAt, orAt);
            if (next < 0) {
                break;
            }
            Connector connector = next == andAt ? Connector.AND : Connector.OR;
            conditions.add(clause(text.substring(start, next), pending, connector, next));
            pending = connector;
            i = next + connector.name().length();
            start = i;
        }

        String last = text.substring(start).trim();
        if (last.isEmpty()) {
            throw new MissingOperandException(
                    "Missing condition after \"" + pending.name() + "\".", text.length());
        }
        conditions.add(new ConditionText(last, pending));
        return List.copyOf(conditions);
    }

    private static ConditionText clause(String raw, Connector connector, Connector following, int position) {
        String trimmed = raw.trim();
        if (trimmed.isEmpty()) {
            throw new MissingOperandException(
                    "Missing condition before \"" + following.name() + "\".", position);
        }
        return new ConditionText(trimmed, connector);
    }

    private static int nearest(int a, int b) {
        if (a < 0) {
            return b;
        }
        if (b < 0) {
            return a;
        }
        return Math.min(a, b);
    }
}
