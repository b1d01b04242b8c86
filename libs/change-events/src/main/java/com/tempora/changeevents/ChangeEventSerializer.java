package com.tempora.changeevents;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JSON serialization and deserialization for {@link ChangeEvent}.
 *
 * <p>The {@code JavaTimeModule} writes {@code Instant} values as ISO 8601 strings.
 */
public final class ChangeEventSerializer {

    private static final ObjectMapper MAPPER = createMapper();

    private ChangeEventSerializer() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Serializes a change event to a JSON string.
     *
     * @throws ChangeEventSerializationException if serialization fails
     */
    public static String serialize(ChangeEvent event) {
        try {
            return MAPPER.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new ChangeEventSerializationException(
                    "Failed to serialize change event: " + event.eventId(), e);
        }
    }

    /**
     * Deserializes a JSON string to a change event.
     *
     * @throws ChangeEventSerializationException if the JSON is malformed or incomplete
     */
    public static ChangeEvent deserialize(String json) {
        try {
            return MAPPER.readValue(json, ChangeEvent.class);
        } catch (JsonProcessingException e) {
            throw new ChangeEventSerializationException("Failed to deserialize change event", e);
        }
    }

    /** Thrown when change event serialization/deserialization fails. */
    public static class ChangeEventSerializationException extends RuntimeException {
        public ChangeEventSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
