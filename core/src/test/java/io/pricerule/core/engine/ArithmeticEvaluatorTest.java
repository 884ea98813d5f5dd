package io.pricerule.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.pricerule.core.error.DivisionByZeroException;
import io.pricerule.core.error.InvalidNumberException;
import io.pricerule.core.error.LimitExceededException;
import io.pricerule.core.error.MissingOperandException;
import io.pricerule.core.error.RuleException;
import io.pricerule.core.error.UnbalancedParenthesesException;
import io.pricerule.core.error.UnexpectedCharacterException;
import io.pricerule.core.error.UnknownVariableException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/**
 * Tests for {@link ArithmeticEvaluator}: precedence, unary signs, variables, error positions
 * and the length and nesting ceilings.
 */
@DisplayName("ArithmeticEvaluator")
class ArithmeticEvaluatorTest {

    private final ArithmeticEvaluator evaluator = new ArithmeticEvaluator();

    @Nested
    @DisplayName("Valid expressions")
    class Valid {

        @ParameterizedTest(name = "{0} = {1}")
        @CsvSource(
                delimiter = '|',
                value = {
                    "2 + 3 * 4       | 14",
                    "(2 + 3) * 4     | 20",
                    "10 - 4 - 3      | 3",
                    "10 / 4          | 2.5",
                    "-3 + +2         | -1",
                    "--5             | 5",
                    ".5 * 4          | 2",
                    "1. + 1          | 2",
                    "2 * (3 + (4 - 1)) | 12"
                })
        void evaluates(String expression, double expected) {
            assertThat(evaluator.evaluate(expression, Map.of())).isEqualTo(expected);
        }

        @Test
        @DisplayName("variables resolve from the supplied map")
        void variables() {
            double result = evaluator.evaluate("booking_hours * 10 + nights", Map.of("booking_hours", 3.0, "nights", 2.0));

            assertThat(result).isEqualTo(32.0);
        }

        @Test
        @DisplayName("every variable reference is reported in reading order")
        void onVariable() {
            List<String> seen = new ArrayList<>();

            evaluator.evaluate("a + b * a", Map.of("a", 1.0, "b", 2.0), seen::add);

            assertThat(seen).containsExactly("a", "b", "a");
        }

        @Test
        @DisplayName("referencedVariables binds keys to one so a bare divisor is accepted")
        void referencedVariables() {
            assertThat(evaluator.referencedVariables("100 / booking_hours + nights / booking_hours", List.of("booking_hours", "nights")))
                    .containsExactly("booking_hours", "nights");
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("blank input asks for a formula")
        void blank() {
            assertThatThrownBy(() -> evaluator.evaluate("   ", Map.of()))
                    .isInstanceOf(MissingOperandException.class)
                    .hasMessage("Enter a formula before validating.");
        }

        @Test
        @DisplayName("division by zero points at the operator")
        void divisionByZero() {
            assertThatThrownBy(() -> evaluator.evaluate("10 / 0", Map.of()))
                    .isInstanceOf(DivisionByZeroException.class)
                    .hasMessage("Division by zero.")
                    .extracting(e -> ((RuleException) e).position())
                    .isEqualTo(3);
        }

        @Test
        @DisplayName("a divisor that evaluates to zero is rejected")
        void computedZeroDivisor() {
            assertThatThrownBy(() -> evaluator.evaluate("10 / (2 - 2)", Map.of()))
                    .isInstanceOf(DivisionByZeroException.class);
        }

        @Test
        @DisplayName("a dangling operator reports the unexpected end")
        void danglingOperator() {
            assertThatThrownBy(() -> evaluator.evaluate("2 +", Map.of()))
                    .isInstanceOf(MissingOperandException.class)
                    .hasMessage("Unexpected end of expression.");
        }

        @Test
        @DisplayName("an unclosed parenthesis points at the opening one")
        void unclosedParenthesis() {
            assertThatThrownBy(() -> evaluator.evaluate("1 + (2 + 3", Map.of()))
                    .isInstanceOf(UnbalancedParenthesesException.class)
                    .hasMessage("Expected closing parenthesis.")
                    .extracting(e -> ((RuleException) e).position())
                    .isEqualTo(4);
        }

        @Test
        @DisplayName("input left after a complete expression is rejected")
        void trailingInput() {
            assertThatThrownBy(() -> evaluator.evaluate("2 + 3)", Map.of()))
                    .isInstanceOf(UnexpectedCharacterException.class)
                    .hasMessage("Unexpected character \")\".")
                    .extracting(e -> ((RuleException) e).position())
                    .isEqualTo(5);
        }

        @Test
        @DisplayName("a character no token can start with is rejected")
        void unexpectedCharacter() {
            assertThatThrownBy(() -> evaluator.evaluate("2 $ 3", Map.of()))
                    .isInstanceOf(UnexpectedCharacterException.class)
                    .hasMessage("Unexpected character \"$\".");
        }

        @Test
        @DisplayName("an unknown variable is named in the error")
        void unknownVariable() {
            assertThatThrownBy(() -> evaluator.evaluate("foo + 1", Map.of()))
                    .isInstanceOf(UnknownVariableException.class)
                    .hasMessage("Unknown variable \"foo\".")
                    .satisfies(e -> assertThat(((UnknownVariableException) e).variableKey()).isEqualTo("foo"));
        }

        @Test
        @DisplayName("a lone decimal point is not a number")
        void lonePoint() {
            assertThatThrownBy(() -> evaluator.evaluate(".", Map.of()))
                    .isInstanceOf(InvalidNumberException.class)
                    .hasMessage("Invalid number literal.");
        }

        @Test
        @DisplayName("a literal too large for a double is rejected")
        void hugeLiteral() {
            assertThatThrownBy(() -> evaluator.evaluate("1" + "0".repeat(400), Map.of()))
                    .isInstanceOf(InvalidNumberException.class);
        }

        @Test
        @DisplayName("an overflowing result is rejected")
        void overflowingResult() {
            String big = "1" + "0".repeat(300);

            assertThatThrownBy(() -> evaluator.evaluate(big + " * " + big, Map.of()))
                    .isInstanceOf(InvalidNumberException.class)
                    .hasMessage("Expression evaluates to an invalid number.");
        }

        @Test
        @DisplayName("an intermediate overflow is rejected at its operator, not divided away")
        void intermediateOverflow() {
            String big = "1" + "0".repeat(300);
            String expression = "1 / (" + big + " * " + big + ")";

            assertThatThrownBy(() -> evaluator.evaluate(expression, Map.of()))
                    .isInstanceOf(InvalidNumberException.class)
                    .extracting(e -> ((RuleException) e).position())
                    .isEqualTo(expression.indexOf('*'));
        }
    }

    @Nested
    @DisplayName("Limits")
    class Limits {

        @Test
        @DisplayName("parentheses up to the nesting ceiling are accepted")
        void nestingWithinLimit() {
            ArithmeticEvaluator shallow = new ArithmeticEvaluator(new EngineLimits(2000, 4000, 3, 50));

            assertThat(shallow.evaluate("(((1)))", Map.of())).isEqualTo(1.0);
            assertThat(shallow.evaluate("---1", Map.of())).isEqualTo(-1.0);
        }

        @Test
        @DisplayName("parentheses and unary signs beyond the ceiling are rejected")
        void nestingBeyondLimit() {
            ArithmeticEvaluator shallow = new ArithmeticEvaluator(new EngineLimits(2000, 4000, 3, 50));

            assertThatThrownBy(() -> shallow.evaluate("((((1))))", Map.of()))
                    .isInstanceOf(LimitExceededException.class)
                    .hasMessage("Formula exceeds maximum nesting depth of 3.");
            assertThatThrownBy(() -> shallow.evaluate("----1", Map.of()))
                    .isInstanceOf(LimitExceededException.class);
        }

        @Test
        @DisplayName("deeply nested input fails cleanly instead of overflowing the stack")
        void deepNesting() {
            ArithmeticEvaluator roomy = new ArithmeticEvaluator(new EngineLimits(100_000, 100_000, 64, 50));
            String deep = "(".repeat(10_000) + "1" + ")".repeat(10_000);

            assertThatThrownBy(() -> roomy.evaluate(deep, Map.of()))
                    .isInstanceOf(LimitExceededException.class)
                    .satisfies(e -> assertThat(((LimitExceededException) e).limit()).isEqualTo(64));
        }

        @Test
        @DisplayName("an expression longer than the ceiling is rejected before parsing")
        void tooLong() {
            ArithmeticEvaluator tight = new ArithmeticEvaluator(new EngineLimits(10, 4000, 64, 50));

            assertThatThrownBy(() -> tight.evaluate("1+1+1+1+1+1", Map.of()))
                    .isInstanceOf(LimitExceededException.class)
                    .hasMessage("Formula exceeds maximum length of 10 characters.");
        }

        @Test
        @DisplayName("non-positive limits are refused")
        void invalidLimits() {
            assertThatThrownBy(() -> new EngineLimits(0, 4000, 64, 50))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("maxFormulaLength must be positive, got: 0");
        }
    }
}
