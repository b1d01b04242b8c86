package com.tempora.changeevents;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ChangeEventSerializer")
class ChangeEventSerializerTest {

    private static final Instant TS = Instant.parse("2025-03-01T10:15:30.123456Z");

    private ChangeEvent sampleEvent(Long oldSeq, long newSeq) {
        ObjectNode payload = JsonNodeFactory.instance.objectNode().put("status", "COMPLETED");
        return ChangeEventFactory.create(
                "T1", "script_execution", "BUILD_42", "ab12", oldSeq, true, newSeq, true,
                payload, "alice", "ci", TS, "corr-1");
    }

    @Nested
    @DisplayName("serialize()")
    class Serialize {

        @Test
        @DisplayName("writes change type using its canonical value")
        void changeTypeAsCanonicalValue() {
            String json = ChangeEventSerializer.serialize(sampleEvent(1L, 2L));

            assertThat(json).contains("\"changeType\":\"Updated\"");
        }

        @Test
        @DisplayName("writes timestamp as ISO 8601 string")
        void timestampAsIso8601() {
            String json = ChangeEventSerializer.serialize(sampleEvent(1L, 2L));

            assertThat(json).contains("\"timestamp\":\"2025-03-01T10:15:30.123456Z\"");
        }

        @Test
        @DisplayName("does not leak derived accessors into JSON")
        void noDerivedProperties() {
            String json = ChangeEventSerializer.serialize(sampleEvent(null, 1L));

            assertThat(json).doesNotContain("firstVersion");
        }
    }

    @Nested
    @DisplayName("deserialize()")
    class Deserialize {

        @Test
        @DisplayName("restores every field including the nested payload")
        void restoresFields() {
            ChangeEvent original = sampleEvent(3L, 7L);

            ChangeEvent restored =
                    ChangeEventSerializer.deserialize(ChangeEventSerializer.serialize(original));

            assertThat(restored).isEqualTo(original);
            assertThat(restored.payload().get("status").asText()).isEqualTo("COMPLETED");
        }

        @Test
        @DisplayName("keeps a null previous version for first-version events")
        void nullPreviousVersion() {
            ChangeEvent restored =
                    ChangeEventSerializer.deserialize(
                            ChangeEventSerializer.serialize(sampleEvent(null, 1L)));

            assertThat(restored.oldVersionSeq()).isNull();
            assertThat(restored.isFirstVersion()).isTrue();
            assertThat(restored.changeType()).isEqualTo(ChangeType.CREATED);
        }

        @Test
        @DisplayName("throws on malformed JSON")
        void malformedJson() {
            assertThatThrownBy(() -> ChangeEventSerializer.deserialize("{not json"))
                    .isInstanceOf(ChangeEventSerializer.ChangeEventSerializationException.class);
        }
    }
}
