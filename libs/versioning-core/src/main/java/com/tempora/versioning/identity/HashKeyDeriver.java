package com.tempora.versioning.identity;

import com.tempora.changeevents.ValidationResult;
import com.tempora.tenancy.TenantScope;
import com.tempora.versioning.error.StoreValidationException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.List;

/**
 * Derives the identity key of an entity from {@code (entityType, tenantId, businessKey)}.
 *
 * <p>The key is SHA-256 over the UTF-8 bytes of {@code entityType + "\0" + tenantId + "\0" +
 * businessKey}. The NUL separator cannot appear in any of the three inputs, so two different
 * triples never hash the same input bytes. Stateless and thread-safe.
 */
public final class HashKeyDeriver {

    /** Maximum entity type length. */
    public static final int MAX_ENTITY_TYPE_LENGTH = 100;

    /** Maximum business key length. */
    public static final int MAX_BUSINESS_KEY_LENGTH = 255;

    private static final char SEPARATOR = '\0';

    /**
     * Derives the identity key.
     *
     * @throws StoreValidationException if any input is blank, too long or contains a NUL character
     */
    public IdentityKey derive(String entityType, String tenantId, String businessKey) {
        ValidationResult result = validate(entityType, tenantId, businessKey);
        if (!result.valid()) {
            throw new StoreValidationException(result);
        }
        String material = entityType + SEPARATOR + tenantId + SEPARATOR + businessKey;
        return IdentityKey.fromBytes(sha256(material.getBytes(StandardCharsets.UTF_8)));
    }

    /** Validates the identity fields without deriving, collecting every error. */
    public ValidationResult validate(String entityType, String tenantId, String businessKey) {
        List<String> errors = new ArrayList<>();
        check(errors, "entityType", entityType, MAX_ENTITY_TYPE_LENGTH);
        check(errors, "tenantId", tenantId, TenantScope.MAX_TENANT_ID_LENGTH);
        check(errors, "businessKey", businessKey, MAX_BUSINESS_KEY_LENGTH);
        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    private static void check(List<String> errors, String field, String value, int maxLength) {
        if (value == null || value.isBlank()) {
            errors.add(field + " must not be blank");
        } else if (value.length() > maxLength) {
            errors.add(field + " must be at most " + maxLength + " characters");
        } else if (value.indexOf(SEPARATOR) >= 0) {
            errors.add(field + " must not contain NUL characters");
        }
    }

    static byte[] sha256(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input);
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
