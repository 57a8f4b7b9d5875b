package com.atrium.access.spi;

import com.atrium.security.Principal;
import com.atrium.security.Role;

/**
 * A stored user as the access layer needs it.
 *
 * @param id           user id
 * @param tenantId     the organization the user belongs to
 * @param email        normalized (trimmed, lower-case) login email
 * @param role         the user's single role
 * @param passwordHash PHC-format credential hash; never logged
 */
public record UserAccount(long id, long tenantId, String email, Role role, String passwordHash) {

    public Principal toPrincipal() {
        return new Principal(id, tenantId, role);
    }

    @Override
    public String toString() {
        return "UserAccount[id=%d, tenantId=%d, email=%s, role=%s]".formatted(id, tenantId, email, role);
    }
}
