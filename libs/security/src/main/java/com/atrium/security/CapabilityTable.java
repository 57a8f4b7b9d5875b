package com.atrium.security;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * The fixed role → capability table.
 * <p>
 * Every grant is listed here and nowhere else. Admin may update or delete any resource of
 * its tenant because it holds {@link Capability#UPDATE_ANY} and {@link Capability#DELETE_ANY};
 * that exemption is not derived from admin "containing" editor.
 *
 * <table>
 *   <tr><th>Role</th><th>Capabilities</th></tr>
 *   <tr><td>admin</td><td>read, create, update-any, delete-any, manage-users, view-audit</td></tr>
 *   <tr><td>editor</td><td>read, create, update-own, delete-own, create-tag</td></tr>
 *   <tr><td>viewer</td><td>read</td></tr>
 * </table>
 */
public final class CapabilityTable {

    private static final Map<Role, Set<Capability>> GRANTS = buildGrants();

    private CapabilityTable() {
        // utility class
    }

    private static Map<Role, Set<Capability>> buildGrants() {
        Map<Role, Set<Capability>> grants = new EnumMap<>(Role.class);
        grants.put(Role.ADMIN, Collections.unmodifiableSet(EnumSet.of(
                Capability.READ,
                Capability.CREATE,
                Capability.UPDATE_ANY,
                Capability.DELETE_ANY,
                Capability.MANAGE_USERS,
                Capability.VIEW_AUDIT)));
        grants.put(Role.EDITOR, Collections.unmodifiableSet(EnumSet.of(
                Capability.READ,
                Capability.CREATE,
                Capability.UPDATE_OWN,
                Capability.DELETE_OWN,
                Capability.CREATE_TAG)));
        grants.put(Role.VIEWER, Collections.unmodifiableSet(EnumSet.of(
                Capability.READ)));
        return Collections.unmodifiableMap(grants);
    }

    /**
     * Returns the capabilities granted to a role (unmodifiable).
     */
    public static Set<Capability> capabilitiesOf(Role role) {
        Set<Capability> granted = GRANTS.get(role);
        if (granted == null) {
            throw new IllegalStateException("No capability entry for role " + role);
        }
        return granted;
    }

    /**
     * Checks whether the role holds the given capability.
     */
    public static boolean grants(Role role, Capability capability) {
        return capabilitiesOf(role).contains(capability);
    }
}
