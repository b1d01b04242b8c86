package com.tempora.tenancy;

/**
 * Explicit tenant scope passed to every public store operation.
 *
 * <p>There is no ambient or thread-bound tenant: a caller that wants to read or write must name the
 * tenant, and everything it touches is filtered by this value.
 *
 * @param tenantId unique tenant identifier (supplied by the external authentication layer)
 */
public record TenantScope(String tenantId) {

    /** Maximum tenant identifier length, matching the identity table column. */
    public static final int MAX_TENANT_ID_LENGTH = 100;

    /**
     * Compact constructor: rejects blank or oversized tenant identifiers.
     *
     * @throws IllegalArgumentException if the tenant identifier is invalid
     */
    public TenantScope {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be null or blank");
        }
        if (tenantId.length() > MAX_TENANT_ID_LENGTH) {
            throw new IllegalArgumentException(
                    "tenantId must be at most %d characters".formatted(MAX_TENANT_ID_LENGTH));
        }
    }

    /** Shorthand for {@code new TenantScope(tenantId)}. */
    public static TenantScope of(String tenantId) {
        return new TenantScope(tenantId);
    }

    /** Returns true when a resource owned by {@code resourceTenantId} is visible in this scope. */
    public boolean owns(String resourceTenantId) {
        return tenantId.equals(resourceTenantId);
    }
}
