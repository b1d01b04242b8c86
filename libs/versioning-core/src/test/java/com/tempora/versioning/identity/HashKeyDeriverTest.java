package com.tempora.versioning.identity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tempora.versioning.error.StoreValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("HashKeyDeriver")
class HashKeyDeriverTest {

    private final HashKeyDeriver deriver = new HashKeyDeriver();

    @Nested
    @DisplayName("derive")
    class Derive {

        @Test
        @DisplayName("is deterministic")
        void deterministic() {
            IdentityKey first = deriver.derive("script_execution", "T1", "BUILD_42");
            IdentityKey second = deriver.derive("script_execution", "T1", "BUILD_42");

            assertThat(first).isEqualTo(second);
            assertThat(first.hex()).hasSize(IdentityKey.HEX_LENGTH);
            assertThat(first.bytes()).hasSize(32);
        }

        @Test
        @DisplayName("matches SHA-256 over NUL-separated fields")
        void knownValue() {
            IdentityKey key = deriver.derive("a", "b", "c");

            assertThat(key).isEqualTo(IdentityKey.fromBytes(HashKeyDeriver.sha256("a\0b\0c".getBytes())));
        }

        @Test
        @DisplayName("does not collide when field boundaries shift")
        void separatorPreventsCollision() {
            IdentityKey ab = deriver.derive("ab", "T1", "c");
            IdentityKey a = deriver.derive("a", "bT1", "c");

            assertThat(ab).isNotEqualTo(a);
            assertThat(deriver.derive("type", "T1", "key")).isNotEqualTo(deriver.derive("type", "T2", "key"));
        }
    }

    @Nested
    @DisplayName("validation")
    class Validation {

        @Test
        @DisplayName("rejects blank fields, collecting every error")
        void blank() {
            assertThatThrownBy(() -> deriver.derive(" ", null, ""))
                    .isInstanceOf(StoreValidationException.class)
                    .satisfies(e -> assertThat(((StoreValidationException) e).errors()).containsExactly(
                            "entityType must not be blank",
                            "tenantId must not be blank",
                            "businessKey must not be blank"));
        }

        @Test
        @DisplayName("rejects oversized business keys")
        void oversized() {
            String key = "k".repeat(HashKeyDeriver.MAX_BUSINESS_KEY_LENGTH + 1);

            assertThatThrownBy(() -> deriver.derive("type", "T1", key))
                    .isInstanceOf(StoreValidationException.class)
                    .hasMessageContaining("businessKey must be at most 255 characters");
        }

        @Test
        @DisplayName("rejects embedded separators")
        void nul() {
            assertThat(deriver.validate("type", "T1", "a\0b").errors())
                    .containsExactly("businessKey must not contain NUL characters");
        }
    }

    @Test
    @DisplayName("IdentityKey rejects malformed hex")
    void malformedKey() {
        assertThatThrownBy(() -> IdentityKey.of("ABC")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> IdentityKey.of("G".repeat(64))).isInstanceOf(IllegalArgumentException.class);
    }
}
