package io.pricerule.core.parser;

import io.pricerule.core.error.MissingOperandException;
import io.pricerule.core.model.Connector;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits rule text holding several clauses, such as
 * {@code IF booking_hours > 8 THEN 500 OR IF booking_hours > 4 THEN 300}.
 *
 * <p>
 * A top-level {@code AND} or {@code OR} starts a new clause only when the next word is
 * {@code IF}. Any other connector belongs to the current clause's condition list.
 *
 * <p>
 * Thread-safe and stateless: all methods are static.
 */
public final class ClauseSplitter {

    private ClauseSplitter() {}

    /**
     * @return clauses in source order, at least one
     * @throws MissingOperandException if the text is blank or a clause is empty
     * @throws io.pricerule.core.error.UnterminatedLiteralException if a quote is never closed
     */
    public static List<ClauseText> split(String text) {
        if (text == null || text.isBlank()) {
            throw new MissingOperandException("Enter a formula before validating.");
        }
        QuoteAwareScanner.requireClosedQuotes(text);

        List<ClauseText> clauses = new ArrayList<>();
        Connector pending = null;
        int start = 0;
        int i = 0;
        while (i < text.length()) {
            int andAt = QuoteAwareScanner.indexOfKeyword(text, "and", i);
            int orAt = QuoteAwareScanner.indexOfKeyword(text, "or", i);
            int at = andAt < 0 ? orAt : (orAt < 0 ? andAt : Math.min(andAt, orAt));
            if (at < 0) {
                break;
            }
            Connector connector = at == andAt ? Connector.AND : Connector.OR;
            int afterConnector = at + connector.name().length();
            if (!startsWithIf(text, afterConnector)) {
                i = afterConnector;
                continue;
            }
            clauses.add(clause(text.substring(start, at), pending, at));
            pending = connector;
            start = afterConnector;
            i = afterConnector;
        }
        clauses.add(clause(text.substring(start), pending, start));
        return List.copyOf(clauses);
    }

    private static boolean startsWithIf(String text, int from) {
        int j = from;
        while (j < text.length() && Character.isWhitespace(text.charAt(j))) {
            j++;
        }
        return j > from && QuoteAwareScanner.isKeywordAt(text, "if", j);
    }

    private static ClauseText clause(String raw, Connector connector, int position) {
        String trimmed = raw.trim();
        if (trimmed.isEmpty()) {
            throw new MissingOperandException("Empty clause in rule text.", position);
        }
        return new ClauseText(connector, trimmed);
    }
}
