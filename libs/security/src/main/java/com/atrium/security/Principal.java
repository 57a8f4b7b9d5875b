package com.atrium.security;

import java.util.Objects;

/**
 * The authenticated caller of one request.
 * <p>
 * Rebuilt from the access token on every call and discarded with the response; never
 * cached across requests.
 *
 * @param userId   the acting user (token subject)
 * @param tenantId the organization the caller belongs to
 * @param role     the caller's role inside that organization
 */
public record Principal(long userId, long tenantId, Role role) {

    public Principal {
        Objects.requireNonNull(role, "role must not be null");
    }
}
