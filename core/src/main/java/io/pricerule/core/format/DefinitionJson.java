package io.pricerule.core.format;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.pricerule.core.error.MalformedDefinitionException;
import io.pricerule.core.model.Comparator;
import io.pricerule.core.model.Condition;
import io.pricerule.core.model.Connector;
import io.pricerule.core.model.Definition;
import io.pricerule.core.model.Operand;
import io.pricerule.core.model.Rule;
import io.pricerule.core.model.ValueType;
import io.pricerule.core.model.Variable;
import io.pricerule.core.model.VariableType;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads and writes the persisted JSON form of {@link Definition} and {@link Rule}.
 *
 * <p>
 * Input is validated against the bundled {@code schemas/definition.schema.json} (JSON Schema
 * 2020-12) before any model object is built, so a definition that passes is structurally
 * sound. Semantic checks (unknown variables, type mismatches, conflicts) are the job of
 * {@link io.pricerule.core.engine.DefinitionValidator}.
 *
 * <p>
 * Thread-safe and stateless: all methods are static.
 */
public final class DefinitionJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);
    private static final String SCHEMA_RESOURCE = "/schemas/definition.schema.json";
    private static final JsonSchema DEFINITION_SCHEMA = loadSchema();

    private DefinitionJson() {}

    /**
     * Parses definition JSON.
     *
     * @throws MalformedDefinitionException if the text is not JSON or violates the schema
     */
    public static Definition readDefinition(String json) {
        return readDefinition(readTree(json));
    }

    /**
     * Builds a definition from an already parsed tree.
     *
     * @throws MalformedDefinitionException if the tree violates the schema
     */
    public static Definition readDefinition(JsonNode node) {
        validateAgainstSchema(node, "definition");
        List<Variable> variables = new ArrayList<>();
        for (JsonNode v : node.get("variables")) {
            variables.add(new Variable(
                    v.get("key").asText(),
                    v.get("label").asText(),
                    VariableType.fromJsonName(v.get("type").asText()),
                    optionalText(v, "initialValue"),
                    v.path("userInput").asBoolean(false)));
        }
        List<Condition> conditions = new ArrayList<>();
        for (JsonNode c : node.path("conditions")) {
            String connector = optionalText(c, "connector");
            conditions.add(new Condition(
                    c.get("id").asText(),
                    connector == null ? null : Connector.fromKeyword(connector),
                    c.path("negated").asBoolean(false),
                    Comparator.fromSymbol(c.get("comparator").asText()),
                    readOperand(c.get("left")),
                    readOperand(c.get("right"))));
        }
        return new Definition(variables, conditions, optionalText(node, "formula"));
    }

    /**
     * Parses rule JSON: {@code {"name", "description"?, "definition"}}.
     *
     * @throws MalformedDefinitionException if the text is not JSON, lacks a definition object
     *                                      or the definition violates the schema
     */
    public static Rule readRule(String json) {
        JsonNode node = readTree(json);
        if (!node.isObject()) {
            throw new MalformedDefinitionException("Rule JSON must be an object.");
        }
        JsonNode definition = node.get("definition");
        if (definition == null || !definition.isObject()) {
            throw new MalformedDefinitionException("Rule JSON must contain a 'definition' object.");
        }
        JsonNode name = node.get("name");
        if (name != null && !name.isNull() && !name.isTextual()) {
            throw new MalformedDefinitionException("Rule 'name' must be a string.");
        }
        JsonNode description = node.get("description");
        if (description != null && !description.isNull() && !description.isTextual()) {
            throw new MalformedDefinitionException("Rule 'description' must be a string.");
        }
        return new Rule(optionalText(node, "name"), optionalText(node, "description"), readDefinition(definition));
    }

    /** JSON tree of a definition. Absent optional fields are omitted. */
    public static ObjectNode toJson(Definition definition) {
        ObjectNode root = MAPPER.createObjectNode();
        ArrayNode variables = root.putArray("variables");
        for (Variable variable : definition.variables()) {
            ObjectNode v = variables.addObject();
            v.put("key", variable.key());
            v.put("label", variable.label());
            v.put("type", variable.type().jsonName());
            if (variable.initialValue() != null) {
                v.put("initialValue", variable.initialValue());
            }
            if (variable.userInput()) {
                v.put("userInput", true);
            }
        }
        ArrayNode conditions = root.putArray("conditions");
        for (Condition condition : definition.conditions()) {
            ObjectNode c = conditions.addObject();
            c.put("id", condition.id());
            if (condition.connector() != null) {
                c.put("connector", condition.connector().jsonName());
            }
            if (condition.negated()) {
                c.put("negated", true);
            }
            c.put("comparator", condition.comparator().symbol());
            c.set("left", operandToJson(condition.left()));
            c.set("right", operandToJson(condition.right()));
        }
        root.put("formula", definition.formula());
        return root;
    }

    /** JSON tree of a rule. */
    public static ObjectNode toJson(Rule rule) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("name", rule.name());
        if (rule.description() != null) {
            root.put("description", rule.description());
        }
        root.set("definition", toJson(rule.definition()));
        return root;
    }

    public static String writeDefinition(Definition definition) {
        return write(toJson(definition));
    }

    public static String writeRule(Rule rule) {
        return write(toJson(rule));
    }

    private static Operand readOperand(JsonNode node) {
        if ("variable".equals(node.get("kind").asText())) {
            return Operand.variable(node.get("key").asText());
        }
        return new Operand.Literal(
                node.get("value").asText(), ValueType.fromJsonName(node.get("valueType").asText()));
    }

    private static ObjectNode operandToJson(Operand operand) {
        ObjectNode node = MAPPER.createObjectNode();
        if (operand instanceof Operand.VariableRef ref) {
            node.put("kind", "variable");
            node.put("key", ref.key());
        } else {
            Operand.Literal literal = (Operand.Literal) operand;
            node.put("kind", "literal");
            node.put("value", literal.value());
            node.put("valueType", literal.valueType().jsonName());
        }
        return node;
    }

    private static String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static JsonNode readTree(String json) {
        if (json == null || json.isBlank()) {
            throw new MalformedDefinitionException("Definition JSON is empty.");
        }
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MalformedDefinitionException("Definition is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static void validateAgainstSchema(JsonNode node, String what) {
        Set<ValidationMessage> errors = DEFINITION_SCHEMA.validate(node);
        if (!errors.isEmpty()) {
            String detail = errors.stream().map(ValidationMessage::getMessage).sorted().collect(Collectors.joining("; "));
            throw new MalformedDefinitionException("Invalid " + what + " JSON: " + detail);
        }
    }

    private static String write(JsonNode node) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize definition JSON", e);
        }
    }

    private static JsonSchema loadSchema() {
        try (InputStream in = DefinitionJson.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + SCHEMA_RESOURCE);
            }
            return SCHEMA_FACTORY.getSchema(MAPPER.readTree(in));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load " + SCHEMA_RESOURCE, e);
        }
    }
}
