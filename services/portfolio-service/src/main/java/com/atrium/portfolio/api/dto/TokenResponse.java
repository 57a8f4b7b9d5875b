package com.atrium.portfolio.api.dto;

import com.atrium.access.AuthenticatedSession;
import java.time.Instant;

/** Issued token pair plus the identity it was issued for. */
public record TokenResponse(
        String accessToken,
        String refreshToken,
        String tokenType,
        String role,
        long orgId,
        long userId,
        Instant accessTokenExpiresAt,
        Instant refreshTokenExpiresAt) {

    public static final String BEARER = "bearer";

    public static TokenResponse from(AuthenticatedSession session) {
        var tokens = session.tokens();
        var principal = session.principal();
        return new TokenResponse(
                tokens.accessToken(),
                tokens.refreshToken(),
                BEARER,
                principal.role().value(),
                principal.tenantId(),
                principal.userId(),
                tokens.accessTokenExpiresAt(),
                tokens.refreshTokenExpiresAt());
    }
}
