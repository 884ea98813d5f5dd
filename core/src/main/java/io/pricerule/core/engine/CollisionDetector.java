package io.pricerule.core.engine;

import io.pricerule.core.error.ConflictingConditionsException;
import io.pricerule.core.error.DuplicateConditionException;
import io.pricerule.core.format.CanonicalSerializer;
import io.pricerule.core.model.Comparator;
import io.pricerule.core.model.Condition;
import io.pricerule.core.model.Connector;
import io.pricerule.core.model.Operand;
import io.pricerule.core.model.ValueType;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Proves that every AND-group of a condition list can be satisfied.
 *
 * <p>
 * Grouping is flat and left to right: each {@code OR} starts a new group. Groups are never
 * compared with each other, since they are alternatives.
 *
 * <p>
 * Inside a group, each {@code variable <cmp> literal} condition becomes a {@link Constraint}
 * ({@code NOT} folded into the comparator, {@code literal <cmp> variable} flipped). A repeated
 * constraint is a {@link DuplicateConditionException}. Plain number literals narrow a
 * per-variable interval; text literals under {@code =} and {@code !=} track an equal value and
 * exclusions. A constraint set with no solution is a {@link ConflictingConditionsException}.
 * Expression literals, date and time literals, and text ordering take part in the duplicate
 * check only.
 *
 * <p>
 * Exclusions compare {@code double} values exactly.
 *
 * <p>
 * Thread-safe and stateless: all methods are static.
 */
public final class CollisionDetector {

    private static final Pattern PLAIN_NUMBER = Pattern.compile("^[+-]?\\d+(\\.\\d+)?$");

    private CollisionDetector() {}

    /**
     * A {@code variable <cmp> literal} condition after normalisation.
     *
     * @param key        variable key
     * @param comparator comparator with negation folded in, variable on the left
     * @param literal    the literal side
     */
    public record Constraint(String key, Comparator comparator, Operand.Literal literal) {

        /** {@code key|comparator|value}, with numbers in canonical form. */
        public String fingerprint() {
            return key + "|" + comparator.symbol() + "|" + canonicalValue(literal);
        }
    }

    /** A one-sided interval limit. */
    record Bound(double value, boolean inclusive) {}

    /**
     * @throws DuplicateConditionException    if a group repeats a constraint
     * @throws ConflictingConditionsException if a group cannot be satisfied
     */
    public static void check(List<Condition> conditions) {
        for (List<Condition> group : groups(conditions)) {
            checkGroup(group);
        }
    }

    /** Partitions {@code conditions} into AND-groups. */
    public static List<List<Condition>> groups(List<Condition> conditions) {
        List<List<Condition>> groups = new ArrayList<>();
        List<Condition> current = new ArrayList<>();
        for (Condition condition : conditions) {
            if (condition.connector() == Connector.OR && !current.isEmpty()) {
                groups.add(current);
                current = new ArrayList<>();
            }
            current.add(condition);
        }
        if (!current.isEmpty()) {
            groups.add(current);
        }
        return groups;
    }

    /** Normalises a variable-vs-literal condition; empty for any other shape. */
    public static Optional<Constraint> normalize(Condition condition) {
        Comparator comparator = condition.negated() ? condition.comparator().negate() : condition.comparator();
        if (condition.left() instanceof Operand.VariableRef ref
                && condition.right() instanceof Operand.Literal literal) {
            return Optional.of(new Constraint(ref.key(), comparator, literal));
        }
        if (condition.left() instanceof Operand.Literal literal
                && condition.right() instanceof Operand.VariableRef ref) {
            return Optional.of(new Constraint(ref.key(), comparator.flip(), literal));
        }
        return Optional.empty();
    }

    /** Canonical form of a literal value: numbers without trailing zeros, expressions without spaces. */
    public static String canonicalValue(Operand.Literal literal) {
        if (literal.valueType() != ValueType.NUMBER) {
            return literal.value();
        }
        if (PLAIN_NUMBER.matcher(literal.value()).matches()) {
            BigDecimal number = new BigDecimal(literal.value()).stripTrailingZeros();
            return number.signum() == 0 ? "0" : number.toPlainString();
        }
        return literal.value().replaceAll("\\s+", "");
    }

    private static void checkGroup(List<Condition> group) {
        Set<String> fingerprints = new HashSet<>();
        Map<String, NumericState> numeric = new HashMap<>();
        Map<String, TextState> text = new HashMap<>();

        for (Condition condition : group) {
            Optional<Constraint> normalized = normalize(condition);
            if (normalized.isEmpty()) {
                continue;
            }
            Constraint constraint = normalized.get();
            if (!fingerprints.add(constraint.fingerprint())) {
                throw new DuplicateConditionException(
                        "Condition \"" + CanonicalSerializer.renderCondition(condition)
                                + "\" repeats an earlier condition.",
                        constraint.fingerprint());
            }

            Operand.Literal literal = constraint.literal();
            if (literal.valueType() == ValueType.NUMBER && PLAIN_NUMBER.matcher(literal.value()).matches()) {
                NumericState state = numeric.computeIfAbsent(constraint.key(), k -> new NumericState());
                if (!state.apply(constraint.comparator(), Double.parseDouble(literal.value()))) {
                    throw new ConflictingConditionsException(constraint.key());
                }
            } else if (literal.valueType() == ValueType.TEXT && constraint.comparator().isSymmetric()) {
                TextState state = text.computeIfAbsent(constraint.key(), k -> new TextState());
                if (!state.apply(constraint.comparator(), literal.value())) {
                    throw new ConflictingConditionsException(constraint.key());
                }
            }
        }
    }

    /** Interval, pinned value and exclusions for one number variable. */
    private static final class NumericState {

        private Bound lower;
        private Bound upper;
        private Double equal;
        private final Set<Double> excludes = new HashSet<>();

        /** Applies one constraint; {@code false} when the state has become unsatisfiable. */
        boolean apply(Comparator comparator, double rawValue) {
            // -0.0 + 0.0 is 0.0: the exclusion set must agree with == on signed zeros.
            double value = rawValue + 0.0;
            switch (comparator) {
                case GT, GTE -> lower = tighterLower(lower, new Bound(value, comparator == Comparator.GTE));
                case LT, LTE -> upper = tighterUpper(upper, new Bound(value, comparator == Comparator.LTE));
                case EQ -> {
                    if (equal != null && equal != value) {
                        return false;
                    }
                    if (!admits(value) || excludes.contains(value)) {
                        return false;
                    }
                    equal = value;
                    lower = new Bound(value, true);
                    upper = new Bound(value, true);
                }
                case NEQ -> {
                    if (equal != null && equal == value) {
                        return false;
                    }
                    excludes.add(value);
                }
            }
            return consistent();
        }

        private boolean admits(double value) {
            if (lower != null && (value < lower.value() || (value == lower.value() && !lower.inclusive()))) {
                return false;
            }
            return upper == null || (value < upper.value() || (value == upper.value() && upper.inclusive()));
        }

        private boolean consistent() {
            if (equal != null && !admits(equal)) {
                return false;
            }
            if (lower == null || upper == null) {
                return true;
            }
            if (lower.value() > upper.value()) {
                return false;
            }
            if (lower.value() == upper.value()) {
                // Both bounds meet at a single point, which must itself be allowed.
                return lower.inclusive() && upper.inclusive() && !excludes.contains(lower.value());
            }
            return true;
        }

        private static Bound tighterLower(Bound current, Bound next) {
            if (current == null || next.value() > current.value()) {
                return next;
            }
            if (next.value() == current.value() && !next.inclusive()) {
                return next;
            }
            return current;
        }

        private static Bound tighterUpper(Bound current, Bound next) {
            if (current == null || next.value() < current.value()) {
                return next;
            }
            if (next.value() == current.value() && !next.inclusive()) {
                return next;
            }
            return current;
        }
    }

    /** Pinned value and exclusions for one text variable. */
    private static final class TextState {

        private String equal;
        private final Set<String> excludes = new HashSet<>();

        boolean apply(Comparator comparator, String value) {
            if (comparator == Comparator.EQ) {
                if ((equal != null && !equal.equals(value)) || excludes.contains(value)) {
                    return false;
                }
                equal = value;
                return true;
            }
            if (value.equals(equal)) {
                return false;
            }
            excludes.add(value);
            return true;
        }
    }
}
