package io.pricerule.core.model;

import java.util.List;

/**
 * The closed set of comparison operators of the rule language.
 *
 * <p>
 * {@link #BY_SCAN_PRIORITY} lists the symbols longest first. Scanners must test
 * them in that order so that {@code <=} is never read as {@code <} followed by
 * {@code =}.
 */
public enum Comparator {
    LT("<"),
    LTE("<="),
    GT(">"),
    GTE(">="),
    EQ("="),
    NEQ("!=");

    /** Comparators ordered by descending symbol length. */
    public static final List<Comparator> BY_SCAN_PRIORITY = List.of(LTE, GTE, NEQ, LT, GT, EQ);

    private final String symbol;

    Comparator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /** The logical opposite: {@code NOT (a < b)} is {@code a >= b}. */
    public Comparator negate() {
        return switch (this) {
            case LT -> GTE;
            case LTE -> GT;
            case GT -> LTE;
            case GTE -> LT;
            case EQ -> NEQ;
            case NEQ -> EQ;
        };
    }

    /** The comparator to use once both operands are swapped: {@code a < b} is {@code b > a}. */
    public Comparator flip() {
        return switch (this) {
            case LT -> GT;
            case LTE -> GTE;
            case GT -> LT;
            case GTE -> LTE;
            case EQ, NEQ -> this;
        };
    }

    /** {@code true} for {@code =} and {@code !=}, whose result does not depend on operand order. */
    public boolean isSymmetric() {
        return this == EQ || this == NEQ;
    }

    /**
     * Resolves a comparator symbol.
     *
     * @throws IllegalArgumentException if the symbol is not one of the six comparators
     */
    public static Comparator fromSymbol(String symbol) {
        for (Comparator comparator : values()) {
            if (comparator.symbol.equals(symbol)) {
                return comparator;
            }
        }
        throw new IllegalArgumentException("Unknown comparator: '" + symbol + "'");
    }
}
