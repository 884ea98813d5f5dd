package io.pricerule.core.engine;

import static io.pricerule.core.testkit.TestDefinitions.condition;
import static io.pricerule.core.testkit.TestDefinitions.numberCondition;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.pricerule.core.error.ConflictingConditionsException;
import io.pricerule.core.error.InvalidDefinitionException;
import io.pricerule.core.error.InvalidLiteralException;
import io.pricerule.core.error.InvalidNumberException;
import io.pricerule.core.error.LimitExceededException;
import io.pricerule.core.error.TypeMismatchException;
import io.pricerule.core.error.UnknownVariableException;
import io.pricerule.core.model.Comparator;
import io.pricerule.core.model.Condition;
import io.pricerule.core.model.Connector;
import io.pricerule.core.model.Definition;
import io.pricerule.core.model.Operand;
import io.pricerule.core.model.Rule;
import io.pricerule.core.model.ValueType;
import io.pricerule.core.model.Variable;
import io.pricerule.core.model.VariableType;
import io.pricerule.core.testkit.TestDefinitions;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link DefinitionValidator} on definitions built directly, as if read from storage. */
@DisplayName("DefinitionValidator")
class DefinitionValidatorTest {

    private final DefinitionValidator validator =
            new DefinitionValidator(EngineLimits.DEFAULT, new ArithmeticEvaluator());
    private final Definition sample = TestDefinitions.sample().withFormula("booking_hours * 10");

    // --- Helpers ---

    private static void assertInvalid(Runnable call, String path) {
        assertThatThrownBy(call::run)
                .isInstanceOf(InvalidDefinitionException.class)
                .satisfies(e -> assertThat(((InvalidDefinitionException) e).path()).isEqualTo(path));
    }

    private Definition withConditions(Condition... conditions) {
        return sample.withConditions(List.of(conditions));
    }

    @Test
    @DisplayName("a parsed definition validates")
    void parsedDefinition() {
        Definition parsed = new RuleEngine()
                .parse("IF nights > 1 AND NOT city = 'Cebu' THEN nights * 20 ELSE 15", TestDefinitions.sample());

        assertThatCode(() -> validator.validate(parsed)).doesNotThrowAnyException();
    }

    @Nested
    @DisplayName("Parsing context")
    class ParsingContext {

        @Test
        @DisplayName("a blank formula is allowed")
        void blankFormula() {
            Definition context = TestDefinitions.sample();

            assertThatCode(() -> validator.validateContext(context)).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("declarations and stored conditions are still checked")
        void stillChecked() {
            Definition duplicate = TestDefinitions.sample()
                    .plusVariable(Variable.of("nights", "Nights again", VariableType.NUMBER));
            Definition dangling = TestDefinitions.sample().withConditions(List.of(
                    numberCondition(null, "rate", Comparator.GT, "1")));

            assertInvalid(() -> validator.validateContext(duplicate), "variables[9].key");
            assertThatThrownBy(() -> validator.validateContext(dangling)).isInstanceOf(UnknownVariableException.class);
        }
    }

    @Nested
    @DisplayName("Variables")
    class Variables {

        @Test
        @DisplayName("keys must be lowercase snake_case")
        void keyPattern() {
            Definition bad = sample.plusVariable(Variable.of("Bad Key", "Bad", VariableType.NUMBER));

            assertInvalid(() -> validator.validate(bad), "variables[9].key");
        }

        @Test
        @DisplayName("keys must not spell a rule keyword")
        void keywordKey() {
            Definition bad = sample.plusVariable(Variable.of("or", "Or", VariableType.NUMBER));

            assertThatThrownBy(() -> validator.validate(bad))
                    .isInstanceOf(InvalidDefinitionException.class)
                    .hasMessage("Variable key \"or\" is a rule keyword.")
                    .satisfies(e -> assertThat(((InvalidDefinitionException) e).path()).isEqualTo("variables[9].key"));
        }

        @Test
        @DisplayName("keys must be unique")
        void duplicateKey() {
            Definition bad = sample.plusVariable(Variable.of("nights", "Nights again", VariableType.NUMBER));

            assertThatThrownBy(() -> validator.validate(bad))
                    .isInstanceOf(InvalidDefinitionException.class)
                    .hasMessage("Duplicate variable key \"nights\".");
        }

        @Test
        @DisplayName("labels must not be blank")
        void blankLabel() {
            Definition bad = sample.plusVariable(Variable.of("rate", "  ", VariableType.NUMBER));

            assertInvalid(() -> validator.validate(bad), "variables[9].label");
        }

        @Test
        @DisplayName("only number and text variables can be user input")
        void userInput() {
            Definition bad = sample.plusVariable(new Variable("arrival", "Arrival", VariableType.DATE, null, true));

            assertInvalid(() -> validator.validate(bad), "variables[9].userInput");
        }
    }

    @Nested
    @DisplayName("Conditions")
    class Conditions {

        @Test
        @DisplayName("the first condition has no connector and the others need one")
        void connectors() {
            assertInvalid(
                    () -> validator.validate(withConditions(numberCondition(Connector.AND, "nights", Comparator.GT, "1"))),
                    "conditions[0].connector");
            assertInvalid(
                    () -> validator.validate(withConditions(
                            numberCondition(null, "nights", Comparator.GT, "1"),
                            numberCondition(null, "nights", Comparator.LT, "9"))),
                    "conditions[1].connector");
        }

        @Test
        @DisplayName("operands must refer to declared variables")
        void unknownVariable() {
            assertThatThrownBy(() -> validator.validate(withConditions(numberCondition(null, "rate", Comparator.GT, "1"))))
                    .isInstanceOf(UnknownVariableException.class);
        }

        @Test
        @DisplayName("operands must have compatible types")
        void typeMismatch() {
            assertThatThrownBy(() -> validator.validate(withConditions(numberCondition(null, "city", Comparator.EQ, "1"))))
                    .isInstanceOf(TypeMismatchException.class);
        }

        @Test
        @DisplayName("stored literals are re-validated")
        void literals() {
            Condition badDate = condition(null, false, Operand.variable("checkin"), Comparator.EQ,
                    new Operand.Literal("2024-02-30", ValueType.DATE));
            Condition blankNumber = condition(null, false, Operand.variable("nights"), Comparator.EQ,
                    Operand.Literal.number(" "));

            assertThatThrownBy(() -> validator.validate(withConditions(badDate)))
                    .isInstanceOf(InvalidLiteralException.class);
            assertThatThrownBy(() -> validator.validate(withConditions(blankNumber)))
                    .isInstanceOf(InvalidNumberException.class);
        }

        @Test
        @DisplayName("contradicting conditions are rejected")
        void conflicting() {
            assertThatThrownBy(() -> validator.validate(withConditions(
                            numberCondition(null, "nights", Comparator.GT, "10"),
                            numberCondition(Connector.AND, "nights", Comparator.LT, "5"))))
                    .isInstanceOf(ConflictingConditionsException.class);
        }

        @Test
        @DisplayName("the condition count is capped")
        void tooMany() {
            DefinitionValidator tight = new DefinitionValidator(new EngineLimits(2000, 4000, 64, 1), new ArithmeticEvaluator());

            assertThatThrownBy(() -> tight.validate(withConditions(
                            numberCondition(null, "nights", Comparator.GT, "1"),
                            numberCondition(Connector.AND, "nights", Comparator.LT, "9"))))
                    .isInstanceOf(LimitExceededException.class);
        }
    }

    @Nested
    @DisplayName("Formula")
    class Formula {

        @Test
        @DisplayName("a blank formula is rejected")
        void blank() {
            assertThatThrownBy(() -> validator.validate(sample.withFormula(" ")))
                    .isInstanceOf(InvalidDefinitionException.class)
                    .hasMessage("Add a formula to determine the price action.");
        }

        @Test
        @DisplayName("ELSE needs conditions")
        void elseWithoutConditions() {
            assertInvalid(() -> validator.validate(sample.withFormula("10 ELSE 5")), "formula");
        }

        @Test
        @DisplayName("both branches are evaluated")
        void branches() {
            Definition bad = withConditions(numberCondition(null, "nights", Comparator.GT, "1"))
                    .withFormula("10 ELSE rate");

            assertThatThrownBy(() -> validator.validate(bad)).isInstanceOf(UnknownVariableException.class);
        }
    }

    @Nested
    @DisplayName("Rule metadata")
    class RuleMetadata {

        @Test
        @DisplayName("a name is required")
        void name() {
            assertInvalid(() -> validator.validate(new Rule(null, null, sample)), "name");
        }

        @Test
        @DisplayName("descriptions are capped at 500 characters")
        void description() {
            assertThatCode(() -> validator.validate(new Rule("Late checkout", "x".repeat(500), sample)))
                    .doesNotThrowAnyException();
            assertInvalid(() -> validator.validate(new Rule("Late checkout", "x".repeat(501), sample)), "description");
        }
    }
}
