package com.atrium.security;

/**
 * Tenant and ownership metadata of a resource, as seen by the authorization evaluator.
 * <p>
 * Tenant and owner are fixed when the resource is created and never reassigned.
 * {@code ownerUserId} is null for resources without an owner (tags, user accounts) and
 * for tenant-wide collections; owner-scoped capabilities never match such resources.
 *
 * @param tenantId    tenant the resource belongs to
 * @param ownerUserId owning user, or null when ownership does not apply
 */
public record ResourceMeta(long tenantId, Long ownerUserId) {

    /** Metadata of a resource owned by a single user. */
    public static ResourceMeta owned(long tenantId, long ownerUserId) {
        return new ResourceMeta(tenantId, ownerUserId);
    }

    /** Metadata of a resource (or collection) that belongs to a tenant but to no single user. */
    public static ResourceMeta unowned(long tenantId) {
        return new ResourceMeta(tenantId, null);
    }

    /**
     * Metadata stamped on a resource the principal is about to create: the principal's own
     * tenant and the principal as owner. There is no way to create on behalf of someone else.
     */
    public static ResourceMeta createdBy(Principal principal) {
        return new ResourceMeta(principal.tenantId(), principal.userId());
    }

    /** True when the given user owns this resource. */
    public boolean isOwnedBy(long userId) {
        return ownerUserId != null && ownerUserId == userId;
    }
}
