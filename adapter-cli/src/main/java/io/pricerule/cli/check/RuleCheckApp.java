package io.pricerule.cli.check;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pricerule.cli.config.CheckerConfig;
import io.pricerule.cli.config.ConfigLoadException;
import io.pricerule.cli.config.ConfigLoader;
import io.pricerule.core.engine.RuleEngine;
import io.pricerule.core.error.RuleException;
import io.pricerule.core.format.CanonicalSerializer;
import io.pricerule.core.format.DefinitionJson;
import io.pricerule.core.model.Definition;
import io.pricerule.core.model.ParsedClause;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line rule checker: parses one rule text against a definition and prints either the
 * parsed result or an RFC 9457 problem document as JSON on stdout.
 *
 * <p>
 * Startup sequence:
 * <ol>
 * <li>Parse arguments</li>
 * <li>Load configuration ({@code --config}, else {@code price-rule-checker.yaml}, else defaults)</li>
 * <li>Configure Logback</li>
 * <li>Read the definition ({@code --definition}, validated, else a fresh one) and the rule
 * text</li>
 * <li>Parse and print</li>
 * </ol>
 *
 * <p>
 * Exit codes: {@link #EXIT_OK} on success, {@link #EXIT_RULE_ERROR} when the rule or the
 * definition is rejected, {@link #EXIT_USAGE} for bad arguments, configuration or unreadable
 * files.
 */
public final class RuleCheckApp {

    private static final Logger LOG = LoggerFactory.getLogger(RuleCheckApp.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final int EXIT_OK = 0;
    public static final int EXIT_RULE_ERROR = 1;
    public static final int EXIT_USAGE = 2;

    private RuleCheckApp() {
        // utility class
    }

    /** Runs against the real environment and working directory. */
    public static int run(String[] args, PrintStream out, PrintStream err) {
        return run(args, out, err, System::getenv, Path.of(""));
    }

    /**
     * Runs the checker.
     *
     * @param args       command-line arguments
     * @param out        receives the JSON result or problem document
     * @param err        receives usage and startup errors
     * @param envLookup  environment variable lookup, {@code null} for undefined
     * @param workingDir directory searched for the default config file
     * @return the process exit code
     */
    public static int run(
            String[] args, PrintStream out, PrintStream err, Function<String, String> envLookup, Path workingDir) {
        CliArguments arguments;
        CheckerConfig config;
        try {
            arguments = CliArguments.parse(args);
            config = ConfigLoader.resolve(arguments.configPath(), workingDir, envLookup);
        } catch (IllegalArgumentException | ConfigLoadException e) {
            err.println(e.getMessage());
            err.println(CliArguments.USAGE);
            return EXIT_USAGE;
        }

        LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
        LOG.info("Configuration loaded: limits={}", config.limits());

        String ruleText;
        String definitionJson;
        try {
            ruleText = arguments.ruleText() != null ? arguments.ruleText() : readFile(arguments.ruleFile());
            definitionJson = arguments.definitionPath() != null ? readFile(arguments.definitionPath()) : null;
        } catch (IOException e) {
            LOG.error("Cannot read input: {}", e.getMessage());
            err.println("Cannot read input: " + e.getMessage());
            return EXIT_USAGE;
        }

        RuleEngine engine = new RuleEngine(config.limits());
        try {
            Definition current = Definition.initial();
            if (definitionJson != null) {
                current = DefinitionJson.readDefinition(definitionJson);
                engine.validateContext(current);
            }
            List<ParsedClause> clauses = engine.parseClauses(ruleText, current);
            out.println(write(result(clauses)));
            return EXIT_OK;
        } catch (RuleException e) {
            LOG.info("Rule rejected: type={}, detail={}", e.urn(), e.getMessage());
            out.println(write(ProblemDetail.ruleError(e)));
            return EXIT_RULE_ERROR;
        }
    }

    /**
     * {@code {"canonical", "clauses": [{"connector"?, "definition"}], "definition"}}. The top-level
     * {@code definition} is the parsed definition for single-clause text and {@code null}
     * otherwise.
     */
    static JsonNode result(List<ParsedClause> clauses) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("canonical", CanonicalSerializer.serializeClauses(clauses));
        ArrayNode clauseArray = root.putArray("clauses");
        for (ParsedClause clause : clauses) {
            ObjectNode node = clauseArray.addObject();
            if (clause.connector() != null) {
                node.put("connector", clause.connector().jsonName());
            }
            node.put("canonical", CanonicalSerializer.serialize(clause.definition()));
            node.set("definition", DefinitionJson.toJson(clause.definition()));
        }
        if (clauses.size() == 1) {
            root.set("definition", DefinitionJson.toJson(clauses.get(0).definition()));
        } else {
            root.putNull("definition");
        }
        return root;
    }

    private static String readFile(Path path) throws IOException {
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    private static String write(JsonNode node) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize result", e);
        }
    }
}
