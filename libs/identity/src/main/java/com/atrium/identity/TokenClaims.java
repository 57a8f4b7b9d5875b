package com.atrium.identity;

import com.atrium.security.Role;

import java.time.Instant;

/**
 * Verified claims of a parsed token.
 * <p>
 * Refresh tokens carry identity only: {@code tenantId} and {@code role} are null for them,
 * because renewal re-reads both from the user record.
 *
 * @param kind      access or refresh
 * @param userId    token subject
 * @param tenantId  tenant claim (access tokens only)
 * @param role      role claim (access tokens only)
 * @param issuedAt  {@code iat}
 * @param expiresAt {@code exp}, always in the future for a freshly parsed token
 * @param tokenId   {@code jti}
 */
public record TokenClaims(
        TokenKind kind,
        long userId,
        Long tenantId,
        Role role,
        Instant issuedAt,
        Instant expiresAt,
        String tokenId
) {
}
