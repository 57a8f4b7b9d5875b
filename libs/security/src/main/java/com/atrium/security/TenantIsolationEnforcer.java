package com.atrium.security;

/**
 * Asserts that a resource handed back by storage belongs to the caller's tenant.
 * <p>
 * Storage lookups are already scoped by tenant; this is the second check that keeps a
 * mis-scoped query from reaching business code. The pipeline turns the resulting
 * {@link TenantMismatchException} into a plain not-found.
 */
public final class TenantIsolationEnforcer {

    private TenantIsolationEnforcer() {
        // utility class
    }

    /**
     * @param principal        the resolved caller
     * @param resourceTenantId the tenant ID of the resource being accessed
     * @throws TenantMismatchException if the tenants do not match
     */
    public static void enforce(Principal principal, long resourceTenantId) {
        if (principal.tenantId() != resourceTenantId) {
            throw new TenantMismatchException(principal.tenantId(), resourceTenantId);
        }
    }
}
