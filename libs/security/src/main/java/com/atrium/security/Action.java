package com.atrium.security;

import java.util.List;

/**
 * Operations a caller can request on a resource, each satisfied by one of an ordered list
 * of capabilities.
 * <p>
 * The evaluator tries the capabilities in order, so unconditional grants
 * ({@code update-any}) are checked before owner-scoped ones ({@code update-own}).
 * Tag creation accepts either the dedicated {@code create-tag} capability or the general
 * {@code create} capability.
 */
public enum Action {

    READ(false, Capability.READ),
    CREATE(true, Capability.CREATE),
    CREATE_TAG(true, Capability.CREATE_TAG, Capability.CREATE),
    UPDATE(true, Capability.UPDATE_ANY, Capability.UPDATE_OWN),
    DELETE(true, Capability.DELETE_ANY, Capability.DELETE_OWN),
    MANAGE_USERS(true, Capability.MANAGE_USERS),
    VIEW_AUDIT(false, Capability.VIEW_AUDIT);

    private final boolean mutating;
    private final List<Capability> acceptedCapabilities;

    Action(boolean mutating, Capability... acceptedCapabilities) {
        this.mutating = mutating;
        this.acceptedCapabilities = List.of(acceptedCapabilities);
    }

    /** Capabilities that can satisfy this action, strongest first. */
    public List<Capability> acceptedCapabilities() {
        return acceptedCapabilities;
    }

    /**
     * True for actions that can change state. {@link #MANAGE_USERS} is mutating even though
     * the same capability also guards listing users; the caller decides per operation
     * whether an audit entry is written.
     */
    public boolean mutating() {
        return mutating;
    }
}
