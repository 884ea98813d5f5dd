package io.pricerule.cli.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for the environment variable overlay on {@link ConfigLoader}.
 *
 * <p>
 * Env vars take precedence over YAML values. An env var counts as set only when it is defined
 * and its trimmed value is non-empty.
 *
 * <p>
 * Uses a map-backed {@code Function<String, String>} instead of the real OS environment.
 */
@DisplayName("Environment variable overlay")
class EnvVarOverlayTest {

    private final Map<String, String> envVars = new HashMap<>();

    private Path fullConfigPath;

    private Function<String, String> envLookup() {
        return envVars::get;
    }

    @BeforeEach
    void setUp() throws Exception {
        fullConfigPath = Path.of(EnvVarOverlayTest.class
                .getClassLoader()
                .getResource("config/full-config.yaml")
                .toURI());
        envVars.clear();
    }

    @Nested
    @DisplayName("Integer overrides")
    class IntegerOverrides {

        @Test
        @DisplayName("every limit can be overridden")
        void limits() {
            envVars.put("PRICE_RULE_MAX_FORMULA_LENGTH", "100");
            envVars.put("PRICE_RULE_MAX_RULE_LENGTH", "200");
            envVars.put("PRICE_RULE_MAX_NESTING_DEPTH", "4");
            envVars.put("PRICE_RULE_MAX_CONDITIONS", " 2 ");

            CheckerConfig config = ConfigLoader.load(fullConfigPath, envLookup());

            assertThat(config.limits().maxFormulaLength()).isEqualTo(100);
            assertThat(config.limits().maxRuleLength()).isEqualTo(200);
            assertThat(config.limits().maxNestingDepth()).isEqualTo(4);
            assertThat(config.limits().maxConditions()).isEqualTo(2);
        }

        @Test
        @DisplayName("a non-integer value → ConfigLoadException naming the variable")
        void notAnInteger() {
            envVars.put("PRICE_RULE_MAX_CONDITIONS", "many");

            assertThatThrownBy(() -> ConfigLoader.load(fullConfigPath, envLookup()))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("PRICE_RULE_MAX_CONDITIONS must be an integer, got: many");
        }

        @Test
        @DisplayName("a non-positive value is rejected even without a config file")
        void nonPositive() {
            envVars.put("PRICE_RULE_MAX_NESTING_DEPTH", "0");

            assertThatThrownBy(() -> ConfigLoader.defaults(envLookup()))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("maxNestingDepth must be positive, got: 0");
        }
    }

    @Nested
    @DisplayName("String overrides")
    class StringOverrides {

        @Test
        @DisplayName("LOG_FORMAT and LOG_LEVEL override the YAML values")
        void logging() {
            envVars.put("LOG_FORMAT", "TEXT");
            envVars.put("LOG_LEVEL", "ERROR");

            CheckerConfig config = ConfigLoader.load(fullConfigPath, envLookup());

            assertThat(config.loggingFormat()).isEqualTo("text");
            assertThat(config.loggingLevel()).isEqualTo("ERROR");
        }
    }

    @Nested
    @DisplayName("Unset semantics")
    class UnsetSemantics {

        @Test
        @DisplayName("blank values leave the YAML value in place")
        void blank() {
            envVars.put("PRICE_RULE_MAX_CONDITIONS", "   ");
            envVars.put("LOG_LEVEL", "");

            CheckerConfig config = ConfigLoader.load(fullConfigPath, envLookup());

            assertThat(config.limits().maxConditions()).isEqualTo(8);
            assertThat(config.loggingLevel()).isEqualTo("DEBUG");
        }

        @Test
        @DisplayName("overrides also apply on top of the built-in defaults")
        void defaults() {
            envVars.put("PRICE_RULE_MAX_CONDITIONS", "5");

            assertThat(ConfigLoader.defaults(envLookup()).limits().maxConditions()).isEqualTo(5);
        }
    }
}
