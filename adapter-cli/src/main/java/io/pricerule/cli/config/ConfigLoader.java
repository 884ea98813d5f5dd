package io.pricerule.cli.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link CheckerConfig} from a YAML file with an environment variable overlay.
 *
 * <pre>
 * limits:
 *   max-formula-length: 2000
 *   max-rule-length: 4000
 *   max-nesting-depth: 64
 *   max-conditions: 50
 * logging:
 *   format: text   # or json
 *   level: WARN
 * </pre>
 *
 * <p>
 * Environment variables take precedence over YAML values. A variable counts as set only when
 * it is defined and non-blank after trimming; otherwise the YAML value (or the default) stands.
 *
 * <table>
 * <caption>Environment overrides</caption>
 * <tr><td>{@code PRICE_RULE_MAX_FORMULA_LENGTH}</td><td>{@code limits.max-formula-length}</td></tr>
 * <tr><td>{@code PRICE_RULE_MAX_RULE_LENGTH}</td><td>{@code limits.max-rule-length}</td></tr>
 * <tr><td>{@code PRICE_RULE_MAX_NESTING_DEPTH}</td><td>{@code limits.max-nesting-depth}</td></tr>
 * <tr><td>{@code PRICE_RULE_MAX_CONDITIONS}</td><td>{@code limits.max-conditions}</td></tr>
 * <tr><td>{@code LOG_FORMAT}</td><td>{@code logging.format}</td></tr>
 * <tr><td>{@code LOG_LEVEL}</td><td>{@code logging.level}</td></tr>
 * </table>
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Read from the working directory when {@code --config} is not given. */
    public static final String DEFAULT_CONFIG_FILE = "price-rule-checker.yaml";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads configuration from {@code configPath}, applying overrides from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static CheckerConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads configuration from {@code configPath}, applying overrides from {@code envLookup}.
     * {@code envLookup} returns {@code null} for undefined variables.
     *
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static CheckerConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }

        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return mapToConfig(root == null ? YAML_MAPPER.createObjectNode() : root, envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (Exception e) {
            throw new ConfigLoadException("Failed to load configuration from: " + configPath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Built-in defaults with environment overrides, for runs without a config file.
     *
     * @throws ConfigLoadException if an override is invalid
     */
    public static CheckerConfig defaults(Function<String, String> envLookup) {
        try {
            return mapToConfig(YAML_MAPPER.createObjectNode(), envLookup);
        } catch (RuntimeException e) {
            throw new ConfigLoadException("Invalid configuration override: " + e.getMessage(), e);
        }
    }

    /**
     * Chooses the configuration source: the explicit path, else {@link #DEFAULT_CONFIG_FILE}
     * when it exists in {@code workingDir}, else the defaults.
     */
    public static CheckerConfig resolve(Path explicitPath, Path workingDir, Function<String, String> envLookup) {
        if (explicitPath != null) {
            return load(explicitPath, envLookup);
        }
        Path fallback = workingDir.resolve(DEFAULT_CONFIG_FILE);
        if (Files.exists(fallback)) {
            return load(fallback, envLookup);
        }
        return defaults(envLookup);
    }

    private static CheckerConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        CheckerConfig.Builder builder = CheckerConfig.builder();

        JsonNode limits = root.path("limits");
        if (limits.has("max-formula-length"))
            builder.maxFormulaLength(requireInt(limits, "max-formula-length"));
        if (limits.has("max-rule-length")) builder.maxRuleLength(requireInt(limits, "max-rule-length"));
        if (limits.has("max-nesting-depth"))
            builder.maxNestingDepth(requireInt(limits, "max-nesting-depth"));
        if (limits.has("max-conditions")) builder.maxConditions(requireInt(limits, "max-conditions"));

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        envInt(envLookup, "PRICE_RULE_MAX_FORMULA_LENGTH", builder::maxFormulaLength);
        envInt(envLookup, "PRICE_RULE_MAX_RULE_LENGTH", builder::maxRuleLength);
        envInt(envLookup, "PRICE_RULE_MAX_NESTING_DEPTH", builder::maxNestingDepth);
        envInt(envLookup, "PRICE_RULE_MAX_CONDITIONS", builder::maxConditions);
        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);

        return builder.build();
    }

    private static int requireInt(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (!value.canConvertToInt() || !value.isIntegralNumber()) {
            throw new ConfigLoadException("limits." + field + " must be an integer, got: " + value.asText());
        }
        return value.asInt();
    }

    // --- Env var helpers ---

    /** {@code true} when the variable is defined and non-blank after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String raw = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(raw));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " must be an integer, got: " + raw, e);
            }
        }
    }
}
