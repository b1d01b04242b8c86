package com.tempora.tenancy;

/**
 * Enforces tenant isolation by comparing a caller's {@link TenantScope} against the tenant that
 * owns a stored resource.
 *
 * <p>Fails fast with {@link TenantMismatchException}; no operation may observe or mutate another
 * tenant's identities or versions.
 */
public final class TenantIsolationEnforcer {

    private TenantIsolationEnforcer() {
        // utility class
    }

    /**
     * Verifies that the scope's tenant matches the resource's tenant.
     *
     * @param scope the caller's tenant scope
     * @param resourceTenantId the tenant ID of the resource being accessed
     * @throws TenantMismatchException if the tenants do not match
     */
    public static void enforce(TenantScope scope, String resourceTenantId) {
        if (!scope.owns(resourceTenantId)) {
            throw new TenantMismatchException(scope.tenantId(), resourceTenantId);
        }
    }

    /**
     * Verifies that a tenant claimed by the transport (e.g. a request header) matches the tenant
     * the operation is addressed to. A null or blank claim is accepted.
     *
     * @param addressedTenantId tenant named by the operation
     * @param claimedTenantId tenant asserted by the authenticated caller, nullable
     * @return the scope for the addressed tenant
     * @throws TenantMismatchException if a claim is present and differs
     */
    public static TenantScope resolve(String addressedTenantId, String claimedTenantId) {
        TenantScope scope = TenantScope.of(addressedTenantId);
        if (claimedTenantId != null && !claimedTenantId.isBlank()) {
            enforce(TenantScope.of(claimedTenantId), addressedTenantId);
        }
        return scope;
    }
}
