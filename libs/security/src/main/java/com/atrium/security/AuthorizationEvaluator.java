package com.atrium.security;

/**
 * Decides whether a principal may perform an action on a resource.
 * <p>
 * The algorithm is total and deterministic:
 * <ol>
 *   <li>Tenant check: a resource of another tenant is denied for every role, admin included.
 *       Nothing below runs for a foreign resource.</li>
 *   <li>Capability check: the role must hold at least one capability that satisfies the
 *       action ({@link Action#acceptedCapabilities()}), per {@link CapabilityTable}.</li>
 *   <li>Ownership check: an owner-scoped capability only matches when the principal owns
 *       the resource. Unconditional capabilities are tried first, so admin's
 *       {@code update-any}/{@code delete-any} never reach this step.</li>
 * </ol>
 */
public final class AuthorizationEvaluator {

    private AuthorizationEvaluator() {
        // utility class
    }

    /**
     * Evaluates the request.
     *
     * @param principal the resolved caller
     * @param action    the requested action
     * @param resource  tenant/owner metadata of the target
     * @return allow, or deny with the internal reason
     */
    public static Decision authorize(Principal principal, Action action, ResourceMeta resource) {
        if (principal == null || action == null || resource == null) {
            throw new IllegalArgumentException("principal, action and resource are required");
        }

        if (resource.tenantId() != principal.tenantId()) {
            return Decision.deny(DenyReason.TENANT_MISMATCH);
        }

        boolean heldOwnerScoped = false;
        for (Capability capability : action.acceptedCapabilities()) {
            if (!CapabilityTable.grants(principal.role(), capability)) {
                continue;
            }
            if (!capability.ownerScoped()) {
                return Decision.allow();
            }
            heldOwnerScoped = true;
            if (resource.isOwnedBy(principal.userId())) {
                return Decision.allow();
            }
        }
        return Decision.deny(heldOwnerScoped ? DenyReason.NOT_OWNER : DenyReason.MISSING_CAPABILITY);
    }
}
