package com.tempora.observability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Redacts sensitive attributes from JSON payloads before they are written to logs or audit sinks.
 *
 * <p>Matching is on attribute names, case-insensitive, at any nesting depth. Default patterns cover
 * credentials and the personal/health identifiers the tracked entities are known to carry.
 */
public final class SensitiveDataRedactor {

    /** The replacement string for redacted values. */
    public static final String REDACTED = "[REDACTED]";

    private static final Set<String> DEFAULT_SENSITIVE_PATTERNS = Set.of(
            "password", "token", "secret", "authorization", "apikey", "credential",
            "ssn", "social_security", "medical_record", "private_key");

    private final Pattern compiledPattern;

    /** Creates a redactor with the default sensitive attribute patterns. */
    public SensitiveDataRedactor() {
        this(DEFAULT_SENSITIVE_PATTERNS);
    }

    /**
     * Creates a redactor with custom attribute name patterns (case-insensitive, substring match).
     *
     * @throws IllegalArgumentException if no patterns are given
     */
    public SensitiveDataRedactor(Set<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            throw new IllegalArgumentException("patterns must not be empty");
        }
        String regex = String.join("|", patterns.stream().map(Pattern::quote).toList());
        this.compiledPattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    /**
     * Returns a deep copy of {@code node} with the values of sensitive attributes replaced by
     * {@value #REDACTED}. The input is never modified. Null input returns null.
     */
    public JsonNode redact(JsonNode node) {
        if (node == null) {
            return null;
        }
        JsonNode copy = node.deepCopy();
        redactInPlace(copy);
        return copy;
    }

    /** Checks whether an attribute name matches any sensitive pattern. */
    public boolean isSensitive(String fieldName) {
        return fieldName != null && compiledPattern.matcher(fieldName).find();
    }

    private void redactInPlace(JsonNode node) {
        if (node instanceof ObjectNode object) {
            Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (isSensitive(field.getKey())) {
                    field.setValue(TextNode.valueOf(REDACTED));
                } else {
                    redactInPlace(field.getValue());
                }
            }
        } else if (node instanceof ArrayNode array) {
            for (JsonNode element : array) {
                redactInPlace(element);
            }
        }
    }
}
