package com.tempora.versioningservice.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.tempora.observability.WriteContext;
import com.tempora.observability.WriteContextHolder;
import com.tempora.tenancy.TenantMismatchException;
import com.tempora.versioning.error.ConcurrencyConflictException;
import com.tempora.versioning.error.PersistenceUnavailableException;
import com.tempora.versioning.error.StoreValidationException;
import com.tempora.versioningservice.api.EntityNotFoundException;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.ProblemDetail;

@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @AfterEach
    void cleanup() {
        WriteContextHolder.clear();
    }

    @Test
    @DisplayName("maps StoreValidationException to 400 with the error list")
    void validation() {
        ProblemDetail result = handler.handleStoreValidation(StoreValidationException.of("actor must not be blank"));

        assertThat(result.getStatus()).isEqualTo(400);
        assertThat(result.getTitle()).isEqualTo("Validation Error");
        assertThat(result.getProperties()).containsEntry("errors", List.of("actor must not be blank"));
    }

    @Test
    @DisplayName("maps TenantMismatchException to 403")
    void tenantMismatch() {
        ProblemDetail result = handler.handleTenantMismatch(new TenantMismatchException("T1", "T2"));

        assertThat(result.getStatus()).isEqualTo(403);
    }

    @Test
    @DisplayName("maps EntityNotFoundException to 404")
    void notFound() {
        ProblemDetail result = handler.handleNotFound(new EntityNotFoundException("agent", "A-1"));

        assertThat(result.getStatus()).isEqualTo(404);
        assertThat(result.getDetail()).contains("agent/A-1");
    }

    @Test
    @DisplayName("maps ConcurrencyConflictException to 409")
    void conflict() {
        ProblemDetail result = handler.handleConflict(new ConcurrencyConflictException("lost the race"));

        assertThat(result.getStatus()).isEqualTo(409);
        assertThat(result.getTitle()).isEqualTo("Concurrent Modification");
    }

    @Test
    @DisplayName("maps PersistenceUnavailableException to 503 without leaking the cause")
    void unavailable() {
        ProblemDetail result = handler.handleUnavailable(
                new PersistenceUnavailableException("Connection refused to db-1:5432"));

        assertThat(result.getStatus()).isEqualTo(503);
        assertThat(result.getDetail()).doesNotContain("db-1");
    }

    @Test
    @DisplayName("maps generic Exception to 500 Internal Server Error")
    void generic() {
        ProblemDetail result = handler.handleGeneric(new RuntimeException("something broke"));

        assertThat(result.getStatus()).isEqualTo(500);
        assertThat(result.getTitle()).isEqualTo("Internal Server Error");
    }

    @Test
    @DisplayName("error response includes timestamp and the current correlation ID")
    void enrichment() {
        WriteContextHolder.set(new WriteContext("corr-1", null, null, null, null));

        ProblemDetail result = handler.handleBadRequest(new IllegalArgumentException("bad"));

        assertThat(result.getProperties()).containsKey("timestamp").containsEntry("correlationId", "corr-1");
    }
}
