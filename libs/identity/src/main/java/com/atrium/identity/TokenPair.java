package com.atrium.identity;

import java.time.Instant;

/**
 * An access token and a refresh token issued together.
 *
 * @param accessToken           bearer token for API calls
 * @param accessTokenExpiresAt  expiry of the access token
 * @param refreshToken          token accepted only by the refresh operation
 * @param refreshTokenExpiresAt expiry of the refresh token
 */
public record TokenPair(
        String accessToken,
        Instant accessTokenExpiresAt,
        String refreshToken,
        Instant refreshTokenExpiresAt
) {

    @Override
    public String toString() {
        return "TokenPair[accessTokenExpiresAt=%s, refreshTokenExpiresAt=%s]"
                .formatted(accessTokenExpiresAt, refreshTokenExpiresAt);
    }
}
