package com.tempora.tenancy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("TenantIsolationEnforcer")
class TenantIsolationEnforcerTest {

    @Nested
    @DisplayName("enforce()")
    class Enforce {

        @Test
        @DisplayName("passes when tenants match")
        void tenantsMatch() {
            assertThatCode(() -> TenantIsolationEnforcer.enforce(TenantScope.of("T1"), "T1"))
                    .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("throws TenantMismatchException carrying both tenant IDs")
        void tenantsMismatch() {
            assertThatThrownBy(() -> TenantIsolationEnforcer.enforce(TenantScope.of("T1"), "T2"))
                    .isInstanceOf(TenantMismatchException.class)
                    .hasMessageContaining("T1")
                    .hasMessageContaining("T2")
                    .satisfies(e -> {
                        var mismatch = (TenantMismatchException) e;
                        assertThat(mismatch.expectedTenantId()).isEqualTo("T1");
                        assertThat(mismatch.actualTenantId()).isEqualTo("T2");
                    });
        }

        @Test
        @DisplayName("treats a null resource tenant as a mismatch")
        void nullResourceTenant() {
            assertThatThrownBy(() -> TenantIsolationEnforcer.enforce(TenantScope.of("T1"), null))
                    .isInstanceOf(TenantMismatchException.class);
        }
    }

    @Nested
    @DisplayName("resolve()")
    class Resolve {

        @Test
        @DisplayName("accepts a missing claim")
        void missingClaim() {
            assertThat(TenantIsolationEnforcer.resolve("T1", null)).isEqualTo(TenantScope.of("T1"));
            assertThat(TenantIsolationEnforcer.resolve("T1", " ")).isEqualTo(TenantScope.of("T1"));
        }

        @Test
        @DisplayName("rejects a claim for a different tenant")
        void conflictingClaim() {
            assertThatThrownBy(() -> TenantIsolationEnforcer.resolve("T1", "T9"))
                    .isInstanceOf(TenantMismatchException.class);
        }
    }

    @Nested
    @DisplayName("TenantScope")
    class Scope {

        @Test
        @DisplayName("rejects blank and oversized tenant IDs")
        void rejectsInvalid() {
            assertThatThrownBy(() -> TenantScope.of(""))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> TenantScope.of("x".repeat(101)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("100");
        }
    }
}
