package io.pricerule.core.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.pricerule.core.engine.ArithmeticEvaluator;
import io.pricerule.core.error.DivisionByZeroException;
import io.pricerule.core.error.InvalidLiteralException;
import io.pricerule.core.error.InvalidNumberException;
import io.pricerule.core.error.MissingOperandException;
import io.pricerule.core.error.UnknownVariableException;
import io.pricerule.core.error.UnrecognizedReferenceException;
import io.pricerule.core.error.UnterminatedLiteralException;
import io.pricerule.core.model.Definition;
import io.pricerule.core.model.Operand;
import io.pricerule.core.model.ValueType;
import io.pricerule.core.testkit.TestDefinitions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/** Tests for {@link OperandParser}: classifier order and the errors each classifier raises. */
@DisplayName("OperandParser")
class OperandParserTest {

    private final OperandParser parser = new OperandParser(new ArithmeticEvaluator());
    private final Definition definition = TestDefinitions.sample();

    private Operand parse(String token) {
        return parser.parse(token, definition);
    }

    @Nested
    @DisplayName("Numbers and text")
    class NumbersAndText {

        @ParameterizedTest
        @ValueSource(strings = {"42", "-3.5", "+7", "0.25"})
        @DisplayName("plain numbers keep their source text")
        void numbers(String token) {
            assertThat(parse(token)).isEqualTo(Operand.Literal.number(token));
        }

        @Test
        @DisplayName("a number too large for a double is an invalid number")
        void nonFinite() {
            String huge = "1" + "0".repeat(400);

            assertThatThrownBy(() -> parse(huge))
                    .isInstanceOf(InvalidNumberException.class)
                    .hasMessage("Invalid number \"" + huge + "\".");
        }

        @Test
        @DisplayName("single and double quotes both make text")
        void quotedText() {
            assertThat(parse("'Manila'")).isEqualTo(Operand.Literal.text("Manila"));
            assertThat(parse("\"O'Hare\"")).isEqualTo(Operand.Literal.text("O'Hare"));
            assertThat(parse("''")).isEqualTo(Operand.Literal.text(""));
        }

        @Test
        @DisplayName("an unclosed quote is an unterminated literal")
        void unterminated() {
            assertThatThrownBy(() -> parse("'Manila"))
                    .isInstanceOf(UnterminatedLiteralException.class);
        }

        @Test
        @DisplayName("an empty token is a missing operand")
        void empty() {
            assertThatThrownBy(() -> parse("  "))
                    .isInstanceOf(MissingOperandException.class)
                    .hasMessage("Operand is empty.");
        }
    }

    @Nested
    @DisplayName("Typed literals")
    class TypedLiterals {

        @Test
        @DisplayName("date() accepts a real calendar date, in any case")
        void date() {
            assertThat(parse("date('2024-02-29')")).isEqualTo(new Operand.Literal("2024-02-29", ValueType.DATE));
            assertThat(parse("DATE(\"2024-01-31\")")).isEqualTo(new Operand.Literal("2024-01-31", ValueType.DATE));
        }

        @Test
        @DisplayName("date() rejects an impossible month")
        void invalidMonth() {
            assertThatThrownBy(() -> parse("date('2024-13-01')"))
                    .isInstanceOf(InvalidLiteralException.class)
                    .hasMessageContaining("2024-13-01")
                    .satisfies(e -> assertThat(((InvalidLiteralException) e).valueType()).isEqualTo(ValueType.DATE));
        }

        @Test
        @DisplayName("time() normalises 12-hour input to 24-hour form")
        void time() {
            assertThat(parse("time('9:30', 'PM')")).isEqualTo(new Operand.Literal("21:30", ValueType.TIME));
            assertThat(parse("time('7:05')")).isEqualTo(new Operand.Literal("07:05", ValueType.TIME));
        }

        @Test
        @DisplayName("datetime() accepts ISO-8601 date-times")
        void datetime() {
            assertThat(parse("datetime('2024-01-31T09:30:00Z')"))
                    .isEqualTo(new Operand.Literal("2024-01-31T09:30:00Z", ValueType.DATETIME));
        }

        @Test
        @DisplayName("an unquoted argument is rejected")
        void unquotedArgument() {
            assertThatThrownBy(() -> parse("date(2024-01-31)"))
                    .isInstanceOf(InvalidLiteralException.class)
                    .hasMessage("Invalid date literal date(2024-01-31): date() expects one quoted argument.");
        }

        @Test
        @DisplayName("too many arguments are rejected")
        void tooManyArguments() {
            assertThatThrownBy(() -> parse("time('9:30', 'PM', 'x')"))
                    .isInstanceOf(InvalidLiteralException.class)
                    .hasMessageContaining("one or two quoted arguments");
        }

        @Test
        @DisplayName("unknown functions are unrecognized references")
        void unknownFunction() {
            assertThatThrownBy(() -> parse("max(1, 2)"))
                    .isInstanceOf(UnrecognizedReferenceException.class)
                    .satisfies(e -> assertThat(((UnrecognizedReferenceException) e).token()).isEqualTo("max(1, 2)"));
        }
    }

    @Nested
    @DisplayName("Expressions and variables")
    class ExpressionsAndVariables {

        @Test
        @DisplayName("arithmetic over number variables is a number literal")
        void expression() {
            assertThat(parse("booking_hours * 2")).isEqualTo(Operand.Literal.number("booking_hours * 2"));
            assertThat(parse("(1 + 2)")).isEqualTo(Operand.Literal.number("(1 + 2)"));
        }

        @Test
        @DisplayName("expressions are checked with variables set to zero")
        void zeroFilled() {
            assertThatThrownBy(() -> parse("10 / nights")).isInstanceOf(DivisionByZeroException.class);
        }

        @Test
        @DisplayName("text variables cannot take part in arithmetic")
        void textInArithmetic() {
            assertThatThrownBy(() -> parse("city + 1"))
                    .isInstanceOf(UnknownVariableException.class)
                    .hasMessage("Unknown variable \"city\".");
        }

        @Test
        @DisplayName("declared identifiers are variable references")
        void variable() {
            assertThat(parse("booking_hours")).isEqualTo(Operand.variable("booking_hours"));
            assertThat(parse("city")).isEqualTo(Operand.variable("city"));
        }

        @ParameterizedTest
        @ValueSource(strings = {"unknown_thing", "12abc", "a.b"})
        @DisplayName("anything else is an unrecognized reference")
        void unrecognized(String token) {
            assertThatThrownBy(() -> parse(token))
                    .isInstanceOf(UnrecognizedReferenceException.class)
                    .hasMessageStartingWith("Unrecognized reference \"" + token + "\".");
        }
    }
}
