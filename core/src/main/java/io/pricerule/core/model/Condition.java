package io.pricerule.core.model;

import java.util.Objects;

/**
 * One comparison in a rule's condition list.
 *
 * @param id         stable identifier (a UUID for parsed conditions)
 * @param connector  how this condition joins the previous one; {@code null} only on the
 *                   first condition of a list
 * @param negated    whether the comparison is wrapped in {@code NOT}
 * @param comparator the comparison operator
 * @param left       left operand
 * @param right      right operand
 */
public record Condition(
        String id, Connector connector, boolean negated, Comparator comparator, Operand left, Operand right) {

    public Condition {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(comparator, "comparator must not be null");
        Objects.requireNonNull(left, "left must not be null");
        Objects.requireNonNull(right, "right must not be null");
    }

    /** Returns a copy joined to its predecessor with the given connector. */
    public Condition withConnector(Connector newConnector) {
        return new Condition(id, newConnector, negated, comparator, left, right);
    }

    /**
     * Compares everything except the id. Parsed conditions get fresh ids, so two parses of
     * the same text are structurally equal but never {@link #equals(Object) equal}.
     */
    public boolean sameStructure(Condition other) {
        return other != null
                && connector == other.connector
                && negated == other.negated
                && comparator == other.comparator
                && left.equals(other.left)
                && right.equals(other.right);
    }
}
