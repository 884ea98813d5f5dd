package io.pricerule.cli.check;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pricerule.core.error.RuleException;
import java.util.Locale;

/**
 * Builds RFC 9457 Problem Details documents for rejected rules.
 *
 * <pre>{@code
 * {
 * "type": "urn:price-rule:error:type-mismatch",
 * "title": "Type Mismatch",
 * "status": 422,
 * "detail": "Type mismatch for \"city\": expected text, got number.",
 * "category": "semantic"
 * }
 * }</pre>
 *
 * <p>
 * Thread-safe: all methods are stateless.
 */
public final class ProblemDetail {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Status for rules that are well-formed requests but cannot be accepted. */
    static final int UNPROCESSABLE = 422;

    private static final String URN_PREFIX = "urn:price-rule:error:";

    private ProblemDetail() {
        // utility class
    }

    /**
     * Problem document for a rule-language error. Adds {@code position} when the error has one.
     */
    public static JsonNode ruleError(RuleException e) {
        ObjectNode node = build(e.urn(), titleOf(e.urn()), UNPROCESSABLE, e.detail());
        node.put("category", e.category().name().toLowerCase(Locale.ROOT));
        if (e.position() != null) {
            node.put("position", e.position());
        }
        return node;
    }

    /** {@code urn:price-rule:error:type-mismatch} becomes {@code Type Mismatch}. */
    static String titleOf(String urn) {
        String slug = urn.startsWith(URN_PREFIX) ? urn.substring(URN_PREFIX.length()) : urn;
        StringBuilder title = new StringBuilder();
        for (String word : slug.split("-")) {
            if (word.isEmpty()) {
                continue;
            }
            if (title.length() > 0) {
                title.append(' ');
            }
            title.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return title.toString();
    }

    static ObjectNode build(String type, String title, int status, String detail) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", type);
        node.put("title", title);
        node.put("status", status);
        node.put("detail", detail);
        return node;
    }
}
