package com.tempora.versioning.payload;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.Map;
import java.util.TreeMap;

/**
 * Writes a JSON tree in canonical form: object fields sorted by name at every depth, array order
 * preserved, no whitespace. Two trees with the same content produce the same string regardless of
 * the order their fields were inserted in.
 *
 * <p>Decimals are read as exact {@code BigDecimal} values, so a canonical string parses back to a
 * tree that writes the same string again.
 */
final class CanonicalJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .setNodeFactory(JsonNodeFactory.withExactBigDecimals(true));

    private CanonicalJson() {
    }

    static String write(JsonNode node) {
        StringWriter out = new StringWriter();
        try (JsonGenerator generator = MAPPER.createGenerator(out)) {
            write(generator, node);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write canonical JSON", e);
        }
        return out.toString();
    }

    /**
     * Returns the tree that {@link #write} output parses to. Binary floating-point nodes become
     * exact decimals, so the result survives a write and re-read unchanged.
     */
    static ObjectNode normalize(ObjectNode node) {
        try {
            return (ObjectNode) MAPPER.readTree(write(node));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to normalize JSON", e);
        }
    }

    static ObjectMapper mapper() {
        return MAPPER;
    }

    private static void write(JsonGenerator generator, JsonNode node) throws IOException {
        if (node.isObject()) {
            Map<String, JsonNode> sorted = new TreeMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                sorted.put(field.getKey(), field.getValue());
            }
            generator.writeStartObject();
            for (Map.Entry<String, JsonNode> field : sorted.entrySet()) {
                generator.writeFieldName(field.getKey());
                write(generator, field.getValue());
            }
            generator.writeEndObject();
        } else if (node.isArray()) {
            generator.writeStartArray();
            for (JsonNode element : node) {
                write(generator, element);
            }
            generator.writeEndArray();
        } else {
            generator.writeTree(node);
        }
    }
}
