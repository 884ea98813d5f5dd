package io.pricerule.core.engine;

import io.pricerule.core.error.DuplicateConditionException;
import io.pricerule.core.model.Comparator;
import io.pricerule.core.model.Condition;
import io.pricerule.core.model.Connector;
import io.pricerule.core.model.Operand;
import io.pricerule.core.model.ParsedClause;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Flags clauses of one rule text whose conditions are the same, whatever their order, operand
 * placement or number formatting.
 *
 * <p>
 * A clause signature lists one entry per condition: the {@link CollisionDetector.Constraint}
 * fingerprint for variable-vs-literal conditions, a structural signature otherwise. The list is
 * sorted when the clause uses only {@code AND} or only {@code OR} and kept in source order
 * when it mixes them. The connector mode is part of the signature, so {@code a AND b} and
 * {@code a OR b} differ.
 *
 * <p>
 * Thread-safe and stateless: all methods are static.
 */
public final class DuplicateClauseDetector {

    private DuplicateClauseDetector() {}

    /**
     * @throws DuplicateConditionException if two clauses share a signature
     */
    public static void check(List<ParsedClause> clauses) {
        Map<String, Integer> seen = new HashMap<>();
        for (int i = 0; i < clauses.size(); i++) {
            String signature = signature(clauses.get(i).definition().conditions());
            Integer earlier = seen.putIfAbsent(signature, i);
            if (earlier != null) {
                throw new DuplicateConditionException(
                        "Clause " + (i + 1) + " repeats the conditions of clause " + (earlier + 1) + ".",
                        signature);
            }
        }
    }

    /** Canonical signature of a condition list; empty conditions give {@code all[]}. */
    public static String signature(List<Condition> conditions) {
        List<String> parts = new ArrayList<>(conditions.size());
        for (Condition condition : conditions) {
            parts.add(conditionSignature(condition));
        }
        String mode = mode(conditions);
        if (!mode.equals("mixed")) {
            parts.sort(null);
        } else {
            for (int i = 1; i < parts.size(); i++) {
                parts.set(i, conditions.get(i).connector().jsonName() + " " + parts.get(i));
            }
        }
        return mode + parts;
    }

    private static String mode(List<Condition> conditions) {
        Connector only = null;
        for (int i = 1; i < conditions.size(); i++) {
            Connector connector = conditions.get(i).connector();
            if (only == null) {
                only = connector;
            } else if (only != connector) {
                return "mixed";
            }
        }
        return only == null ? "all" : only.jsonName();
    }

    private static String conditionSignature(Condition condition) {
        Optional<CollisionDetector.Constraint> constraint = CollisionDetector.normalize(condition);
        if (constraint.isPresent()) {
            return constraint.get().fingerprint();
        }
        Comparator comparator = condition.negated() ? condition.comparator().negate() : condition.comparator();
        String left = operandSignature(condition.left());
        String right = operandSignature(condition.right());
        if (left.compareTo(right) > 0) {
            String swap = left;
            left = right;
            right = swap;
            comparator = comparator.flip();
        }
        return left + "|" + comparator.symbol() + "|" + right;
    }

    private static String operandSignature(Operand operand) {
        if (operand instanceof Operand.VariableRef ref) {
            return "var:" + ref.key();
        }
        Operand.Literal literal = (Operand.Literal) operand;
        return literal.valueType().jsonName() + ":" + CollisionDetector.canonicalValue(literal);
    }
}
