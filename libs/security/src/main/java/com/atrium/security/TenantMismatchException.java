package com.atrium.security;

/**
 * Thrown when a resource of another tenant reaches a tenant-scoped code path.
 * <p>
 * Never shown to callers: the pipeline reports it as {@link NotFoundException} so the
 * existence of foreign resources is not revealed.
 */
public class TenantMismatchException extends RuntimeException {

    private final long expectedTenantId;
    private final long actualTenantId;

    public TenantMismatchException(long expectedTenantId, long actualTenantId) {
        super("Tenant mismatch: caller tenant %d cannot access resource of tenant %d"
                .formatted(expectedTenantId, actualTenantId));
        this.expectedTenantId = expectedTenantId;
        this.actualTenantId = actualTenantId;
    }

    public long expectedTenantId() {
        return expectedTenantId;
    }

    public long actualTenantId() {
        return actualTenantId;
    }
}
