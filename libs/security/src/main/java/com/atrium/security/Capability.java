package com.atrium.security;

/**
 * Permission categories a role can be granted.
 * <p>
 * Owner-scoped capabilities ({@link #UPDATE_OWN}, {@link #DELETE_OWN}) only apply to
 * resources whose owner is the acting user; every other capability applies to any
 * resource of the caller's tenant.
 */
public enum Capability {

    READ("read", false),
    CREATE("create", false),
    UPDATE_ANY("update-any", false),
    DELETE_ANY("delete-any", false),
    UPDATE_OWN("update-own", true),
    DELETE_OWN("delete-own", true),
    CREATE_TAG("create-tag", false),
    MANAGE_USERS("manage-users", false),
    VIEW_AUDIT("view-audit", false);

    private final String value;
    private final boolean ownerScoped;

    Capability(String value, boolean ownerScoped) {
        this.value = value;
        this.ownerScoped = ownerScoped;
    }

    public String value() {
        return value;
    }

    /** True when the capability requires the acting user to own the target resource. */
    public boolean ownerScoped() {
        return ownerScoped;
    }
}
