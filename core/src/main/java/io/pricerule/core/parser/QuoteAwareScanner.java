package io.pricerule.core.parser;

import io.pricerule.core.error.UnterminatedLiteralException;

/**
 * Keyword search over rule text that skips anything between single or double quotes. A quote
 * of one kind inside a quote of the other kind is plain text; there are no escapes.
 */
final class QuoteAwareScanner {

    private static final char NO_QUOTE = '\0';

    private QuoteAwareScanner() {}

    static boolean isQuote(char c) {
        return c == '\'' || c == '"';
    }

    /**
     * Finds the first occurrence of {@code keyword} at or after {@code from} that is outside
     * quotes, matches case-insensitively and is bounded by whitespace or the string edges.
     *
     * @return the start index, or {@code -1} when there is none
     */
    static int indexOfKeyword(String text, String keyword, int from) {
        char quote = NO_QUOTE;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != NO_QUOTE) {
                if (c == quote) {
                    quote = NO_QUOTE;
                }
                continue;
            }
            if (isQuote(c)) {
                quote = c;
                continue;
            }
            if (i >= from && isKeywordAt(text, keyword, i)) {
                return i;
            }
        }
        return -1;
    }

    /** Whether {@code keyword} sits at {@code index} as a whole, whitespace-bounded word. */
    static boolean isKeywordAt(String text, String keyword, int index) {
        return text.regionMatches(true, index, keyword, 0, keyword.length())
                && isBoundary(text, index - 1)
                && isBoundary(text, index + keyword.length());
    }

    /** Positions outside the string count as boundaries. */
    static boolean isBoundary(String text, int index) {
        return index < 0 || index >= text.length() || Character.isWhitespace(text.charAt(index));
    }

    /**
     * Fails when a quote is opened and never closed.
     *
     * @throws UnterminatedLiteralException pointing at the opening quote
     */
    static void requireClosedQuotes(String text) {
        char quote = NO_QUOTE;
        int openedAt = -1;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != NO_QUOTE) {
                if (c == quote) {
                    quote = NO_QUOTE;
                }
            } else if (isQuote(c)) {
                quote = c;
                openedAt = i;
            }
        }
        if (quote != NO_QUOTE) {
            throw new UnterminatedLiteralException("Text starting with " + quote + " is never closed.", openedAt);
        }
    }
}
