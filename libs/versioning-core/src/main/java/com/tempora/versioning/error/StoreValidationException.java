package com.tempora.versioning.error;

import com.tempora.changeevents.ValidationResult;

import java.util.List;

/**
 * Thrown when a write is rejected before anything is persisted: blank or oversized identity
 * fields, a payload over the size limit, or a payload that fails its entity type's schema.
 */
public class StoreValidationException extends VersionStoreException {

    private final ValidationResult result;

    public StoreValidationException(ValidationResult result) {
        super("Validation failed: " + result.summary());
        this.result = result;
    }

    /** Shorthand for a single error. */
    public static StoreValidationException of(String error) {
        return new StoreValidationException(ValidationResult.fail(List.of(error)));
    }

    public ValidationResult result() {
        return result;
    }

    public List<String> errors() {
        return result.errors();
    }
}
