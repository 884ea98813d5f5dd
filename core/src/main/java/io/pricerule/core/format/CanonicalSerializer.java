package io.pricerule.core.format;

import io.pricerule.core.model.Condition;
import io.pricerule.core.model.Definition;
import io.pricerule.core.model.Operand;
import io.pricerule.core.model.ParsedClause;
import java.util.List;

/**
 * Renders definitions back to rule text.
 *
 * <p>
 * Output parses back to structurally equal conditions and the same formula:
 * {@code IF booking_hours >= 4 AND NOT city = 'Manila' THEN booking_hours * 10 ELSE 80}.
 *
 * <p>
 * Thread-safe and stateless: all methods are static.
 */
public final class CanonicalSerializer {

    private CanonicalSerializer() {}

    /** {@code IF <conditions> THEN <formula>}, or the bare formula when there are no conditions. */
    public static String serialize(Definition definition) {
        if (definition.conditions().isEmpty()) {
            return definition.formula();
        }
        return "IF " + renderConditions(definition.conditions()) + " THEN " + definition.formula();
    }

    /** Serializes each clause and joins them with their connectors. */
    public static String serializeClauses(List<ParsedClause> clauses) {
        StringBuilder out = new StringBuilder();
        for (ParsedClause clause : clauses) {
            if (out.length() > 0) {
                out.append(' ').append(clause.connector().name()).append(' ');
            }
            out.append(serialize(clause.definition()));
        }
        return out.toString();
    }

    public static String renderConditions(List<Condition> conditions) {
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < conditions.size(); i++) {
            Condition condition = conditions.get(i);
            if (i > 0) {
                out.append(' ').append(condition.connector().name()).append(' ');
            }
            out.append(renderCondition(condition));
        }
        return out.toString();
    }

    /** One condition without its connector. */
    public static String renderCondition(Condition condition) {
        return (condition.negated() ? "NOT " : "")
                + renderOperand(condition.left())
                + " "
                + condition.comparator().symbol()
                + " "
                + renderOperand(condition.right());
    }

    public static String renderOperand(Operand operand) {
        if (operand instanceof Operand.VariableRef ref) {
            return ref.key();
        }
        Operand.Literal literal = (Operand.Literal) operand;
        return switch (literal.valueType()) {
            case NUMBER -> literal.value();
            case TEXT -> quote(literal.value());
            case DATE -> "date('" + literal.value() + "')";
            case TIME -> "time('" + literal.value() + "')";
            case DATETIME -> "datetime('" + literal.value() + "')";
        };
    }

    /** Single quotes, or double quotes when the text itself holds a single quote. */
    private static String quote(String text) {
        return text.indexOf('\'') >= 0 ? "\"" + text + "\"" : "'" + text + "'";
    }
}
