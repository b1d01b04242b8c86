package com.tempora.versioning.payload;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tempora.versioning.error.StoreValidationException;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Attribute payload of one version: a JSON object.
 *
 * <p>Immutable. The wrapped tree is copied on the way in and on the way out, so a payload that has
 * been digested can never change underneath its digest. Numbers are held in the form they take
 * after a round trip through {@link #canonicalJson()}, so a stored payload reads back equal to the
 * one written. The reserved boolean attribute
 * {@value #ACTIVE_ATTRIBUTE} marks logical deactivation; a payload without it is active.
 */
public final class Payload {

    /** Reserved attribute marking a logically deleted entity when {@code false}. */
    public static final String ACTIVE_ATTRIBUTE = "_active";

    private final ObjectNode node;
    private final String canonical;

    private Payload(ObjectNode node) {
        this.node = node;
        this.canonical = CanonicalJson.write(node);
    }

    /**
     * Wraps a JSON tree.
     *
     * @throws StoreValidationException if the node is missing or not a JSON object
     */
    public static Payload of(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw StoreValidationException.of("payload must be a JSON object");
        }
        return new Payload(CanonicalJson.normalize((ObjectNode) node));
    }

    /**
     * Parses a JSON object.
     *
     * @throws StoreValidationException if the text is not a well-formed JSON object
     */
    public static Payload parse(String json) {
        try {
            return of(CanonicalJson.mapper().readTree(json));
        } catch (JsonProcessingException e) {
            throw StoreValidationException.of("payload is not valid JSON: " + e.getOriginalMessage());
        }
    }

    /** Builds a payload from a map of attribute values. */
    public static Payload fromMap(Map<String, ?> attributes) {
        return of(CanonicalJson.mapper().valueToTree(attributes));
    }

    /** Returns a copy of the JSON tree. */
    public ObjectNode json() {
        return node.deepCopy();
    }

    /** Returns a copy of one attribute. */
    public Optional<JsonNode> get(String attribute) {
        return Optional.ofNullable(node.get(attribute)).map(JsonNode::deepCopy);
    }

    public List<String> attributeNames() {
        List<String> names = new ArrayList<>();
        node.fieldNames().forEachRemaining(names::add);
        return names;
    }

    /** True unless {@value #ACTIVE_ATTRIBUTE} is present and {@code false}. */
    public boolean isActive() {
        JsonNode active = node.get(ACTIVE_ATTRIBUTE);
        return active == null || !active.isBoolean() || active.booleanValue();
    }

    /** Returns a copy with {@value #ACTIVE_ATTRIBUTE} set to the given value. */
    public Payload withActive(boolean active) {
        ObjectNode copy = node.deepCopy();
        copy.put(ACTIVE_ATTRIBUTE, active);
        return new Payload(copy);
    }

    /** Canonical JSON form: sorted keys, no whitespace. */
    public String canonicalJson() {
        return canonical;
    }

    /** Size of the canonical form in UTF-8 bytes. */
    public int sizeBytes() {
        return canonical.getBytes(StandardCharsets.UTF_8).length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Payload other && canonical.equals(other.canonical);
    }

    @Override
    public int hashCode() {
        return Objects.hash(canonical);
    }

    @Override
    public String toString() {
        return canonical;
    }
}
