package com.tempora.changeevents;

import java.util.ArrayList;

/**
 * Validates {@link ChangeEvent} instances for required fields and sequence consistency.
 *
 * <p>Returns every error at once in a {@link ValidationResult}.
 */
public final class ChangeEventValidator {

    private ChangeEventValidator() {
        // utility class
    }

    /**
     * Validates that all required fields are present and the version numbers are consistent.
     *
     * @param event the change event to validate
     * @return a {@link ValidationResult} with any errors found
     */
    public static ValidationResult validate(ChangeEvent event) {
        var errors = new ArrayList<String>();

        if (isBlank(event.eventId())) {
            errors.add("eventId must not be null or blank");
        }
        if (event.changeType() == null) {
            errors.add("changeType must not be null");
        }
        if (isBlank(event.tenantId())) {
            errors.add("tenantId must not be null or blank");
        }
        if (isBlank(event.entityType())) {
            errors.add("entityType must not be null or blank");
        }
        if (isBlank(event.businessKey())) {
            errors.add("businessKey must not be null or blank");
        }
        if (isBlank(event.identityKey())) {
            errors.add("identityKey must not be null or blank");
        }
        if (event.newVersionSeq() < 1) {
            errors.add("newVersionSeq must be >= 1");
        }
        if (event.oldVersionSeq() != null && event.oldVersionSeq() >= event.newVersionSeq()) {
            errors.add("oldVersionSeq must be lower than newVersionSeq");
        }
        if (event.oldVersionSeq() == null && event.changeType() == ChangeType.UPDATED) {
            errors.add("an Updated event must reference the previous version");
        }
        if (event.payload() == null) {
            errors.add("payload must not be null");
        }
        if (isBlank(event.actor())) {
            errors.add("actor must not be null or blank");
        }
        if (event.timestamp() == null) {
            errors.add("timestamp must not be null");
        }

        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
