package io.pricerule.core.engine;

import io.pricerule.core.error.TypeMismatchException;
import io.pricerule.core.error.UnknownVariableException;
import io.pricerule.core.model.Definition;
import io.pricerule.core.model.Operand;
import io.pricerule.core.model.ValueType;
import io.pricerule.core.model.Variable;
import io.pricerule.core.model.VariableType;
import java.util.EnumSet;
import java.util.Set;

/**
 * Checks that the two operands of a comparison can be compared.
 *
 * <ul>
 *   <li>number variables take number literals, text variables take text literals
 *   <li>date variables take date or datetime literals
 *   <li>time variables take time literals
 *   <li>two variables must share their declared type
 *   <li>two literals follow the same table, read from the left literal's kind
 * </ul>
 *
 * <p>
 * Thread-safe and stateless: all methods are static.
 */
public final class TypeChecker {

    private TypeChecker() {}

    /**
     * @throws UnknownVariableException if a variable operand is not declared
     * @throws TypeMismatchException    if the operands are incompatible
     */
    public static void check(Operand left, Operand right, Definition definition) {
        if (left instanceof Operand.VariableRef leftRef && right instanceof Operand.VariableRef rightRef) {
            Variable leftVar = resolve(leftRef, definition);
            Variable rightVar = resolve(rightRef, definition);
            if (leftVar.type() != rightVar.type()) {
                throw new TypeMismatchException(
                        leftVar.key(), leftVar.type().jsonName(), rightVar.type().jsonName());
            }
            return;
        }
        if (left instanceof Operand.VariableRef leftRef) {
            checkVariableAgainstLiteral(resolve(leftRef, definition), (Operand.Literal) right);
            return;
        }
        if (right instanceof Operand.VariableRef rightRef) {
            checkVariableAgainstLiteral(resolve(rightRef, definition), (Operand.Literal) left);
            return;
        }
        Operand.Literal leftLiteral = (Operand.Literal) left;
        Operand.Literal rightLiteral = (Operand.Literal) right;
        if (!literalsCompatible(leftLiteral.valueType(), rightLiteral.valueType())) {
            throw new TypeMismatchException(
                    leftLiteral.value(), leftLiteral.valueType().jsonName(), rightLiteral.valueType().jsonName());
        }
    }

    /** Literal kinds a variable of {@code type} can be compared with. */
    public static Set<ValueType> acceptedLiterals(VariableType type) {
        return switch (type) {
            case NUMBER -> EnumSet.of(ValueType.NUMBER);
            case TEXT -> EnumSet.of(ValueType.TEXT);
            case DATE -> EnumSet.of(ValueType.DATE, ValueType.DATETIME);
            case TIME -> EnumSet.of(ValueType.TIME);
        };
    }

    private static void checkVariableAgainstLiteral(Variable variable, Operand.Literal literal) {
        if (!acceptedLiterals(variable.type()).contains(literal.valueType())) {
            throw new TypeMismatchException(
                    variable.key(), describe(variable.type()), literal.valueType().jsonName());
        }
    }

    private static boolean literalsCompatible(ValueType left, ValueType right) {
        if (left == right) {
            return true;
        }
        return (left == ValueType.DATE && right == ValueType.DATETIME)
                || (left == ValueType.DATETIME && right == ValueType.DATE);
    }

    private static String describe(VariableType type) {
        return type == VariableType.DATE ? "date or datetime" : type.jsonName();
    }

    private static Variable resolve(Operand.VariableRef ref, Definition definition) {
        return definition.variable(ref.key()).orElseThrow(() -> new UnknownVariableException(ref.key(), null));
    }
}
