package com.tempora.changeevents;

import java.util.List;

/**
 * Result of a validation pass: either valid, or a list of every error found.
 *
 * @param valid true if validation passed with no errors
 * @param errors human-readable error messages (empty when valid)
 */
public record ValidationResult(boolean valid, List<String> errors) {

    /** Convenience factory for a successful validation. */
    public static ValidationResult ok() {
        return new ValidationResult(true, List.of());
    }

    /** Convenience factory for a failed validation. */
    public static ValidationResult fail(List<String> errors) {
        return new ValidationResult(false, List.copyOf(errors));
    }

    /** Errors joined with "; ", or an empty string when valid. */
    public String summary() {
        return String.join("; ", errors);
    }
}
