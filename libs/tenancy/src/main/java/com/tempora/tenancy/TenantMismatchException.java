package com.tempora.tenancy;

/**
 * Thrown when an operation attempts to access a resource belonging to a different tenant.
 *
 * <p>Tenant mismatch is a programming or security error, not a recoverable condition.
 */
public class TenantMismatchException extends RuntimeException {

    private final String expectedTenantId;
    private final String actualTenantId;

    public TenantMismatchException(String expectedTenantId, String actualTenantId) {
        super("Tenant mismatch: scope tenant '%s' cannot access resource of tenant '%s'"
                .formatted(expectedTenantId, actualTenantId));
        this.expectedTenantId = expectedTenantId;
        this.actualTenantId = actualTenantId;
    }

    public String expectedTenantId() {
        return expectedTenantId;
    }

    public String actualTenantId() {
        return actualTenantId;
    }
}
