package com.tempora.versioningservice.infrastructure.web;

import com.tempora.observability.WriteContextHolder;
import com.tempora.tenancy.TenantMismatchException;
import com.tempora.versioning.error.ConcurrencyConflictException;
import com.tempora.versioning.error.PersistenceUnavailableException;
import com.tempora.versioning.error.StoreValidationException;
import com.tempora.versioningservice.api.EntityNotFoundException;
import java.net.URI;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps store exceptions to RFC 7807 ProblemDetail responses.
 *
 * <pre>
 * {
 *   "type": "https://tempora.dev/errors/validation",
 *   "title": "Validation Error",
 *   "status": 400,
 *   "detail": "actor must not be blank",
 *   "errors": ["actor must not be blank"],
 *   "timestamp": "2025-03-01T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String ERROR_TYPE_BASE = "https://tempora.dev/errors/";

    @ExceptionHandler(StoreValidationException.class)
    public ProblemDetail handleStoreValidation(StoreValidationException ex) {
        log.warn("Rejected request: {}", ex.getMessage());
        ProblemDetail problem = problem(HttpStatus.BAD_REQUEST, "Validation Error", "validation", ex.getMessage());
        problem.setProperty("errors", ex.errors());
        return problem;
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .reduce((a, b) -> a + "; " + b)
                .orElse("Validation failed");
        return problem(HttpStatus.BAD_REQUEST, "Validation Error", "validation", detail);
    }

    @ExceptionHandler({
        IllegalArgumentException.class,
        HttpMessageNotReadableException.class,
        MethodArgumentTypeMismatchException.class
    })
    public ProblemDetail handleBadRequest(Exception ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", ex.getMessage());
    }

    @ExceptionHandler(TenantMismatchException.class)
    public ProblemDetail handleTenantMismatch(TenantMismatchException ex) {
        log.warn("Cross-tenant access refused: {}", ex.getMessage());
        return problem(HttpStatus.FORBIDDEN, "Forbidden", "tenant-mismatch", ex.getMessage());
    }

    @ExceptionHandler(EntityNotFoundException.class)
    public ProblemDetail handleNotFound(EntityNotFoundException ex) {
        return problem(HttpStatus.NOT_FOUND, "Not Found", "not-found", ex.getMessage());
    }

    @ExceptionHandler(ConcurrencyConflictException.class)
    public ProblemDetail handleConflict(ConcurrencyConflictException ex) {
        log.warn("Write conflict surfaced to client: {}", ex.getMessage());
        return problem(HttpStatus.CONFLICT, "Concurrent Modification", "conflict", ex.getMessage());
    }

    @ExceptionHandler(PersistenceUnavailableException.class)
    public ProblemDetail handleUnavailable(PersistenceUnavailableException ex) {
        log.error("Persistence unavailable", ex);
        return problem(HttpStatus.SERVICE_UNAVAILABLE, "Service Unavailable", "persistence-unavailable",
                "The version store is temporarily unavailable");
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "internal",
                "An unexpected error occurred");
    }

    private static ProblemDetail problem(HttpStatus status, String title, String type, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create(ERROR_TYPE_BASE + type));
        enrichWithCorrelation(problem);
        return problem;
    }

    /** Adds the timestamp and, when one is set, the request's correlation ID. */
    private static void enrichWithCorrelation(ProblemDetail problem) {
        problem.setProperty("timestamp", Instant.now().toString());
        WriteContextHolder.get().ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
    }
}
