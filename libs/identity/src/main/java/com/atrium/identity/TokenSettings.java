package com.atrium.identity;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Signing secret, issuer and lifetimes used by {@link TokenCodec}.
 * <p>
 * Built once from configuration at startup and handed to the codec; the secret is not
 * reachable from anywhere else.
 *
 * @param secret     HMAC signing secret, at least 32 bytes (UTF-8)
 * @param issuer     value of the {@code iss} claim, checked on parse
 * @param accessTtl  lifetime of access tokens (default 30 minutes)
 * @param refreshTtl lifetime of refresh tokens (default 7 days)
 * @param clockSkew  tolerance applied to {@code exp} on parse (default none)
 */
public record TokenSettings(
        String secret,
        String issuer,
        Duration accessTtl,
        Duration refreshTtl,
        Duration clockSkew
) {

    public static final int MIN_SECRET_BYTES = 32;
    public static final String DEFAULT_ISSUER = "atrium";
    public static final Duration DEFAULT_ACCESS_TTL = Duration.ofMinutes(30);
    public static final Duration DEFAULT_REFRESH_TTL = Duration.ofDays(7);

    public TokenSettings {
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new IllegalArgumentException(
                    "token secret must be at least %d bytes".formatted(MIN_SECRET_BYTES));
        }
        if (issuer == null || issuer.isBlank()) {
            issuer = DEFAULT_ISSUER;
        }
        if (accessTtl == null) {
            accessTtl = DEFAULT_ACCESS_TTL;
        }
        if (refreshTtl == null) {
            refreshTtl = DEFAULT_REFRESH_TTL;
        }
        if (clockSkew == null) {
            clockSkew = Duration.ZERO;
        }
        if (accessTtl.isNegative() || accessTtl.isZero() || refreshTtl.isNegative() || refreshTtl.isZero()) {
            throw new IllegalArgumentException("token lifetimes must be positive");
        }
        if (refreshTtl.compareTo(accessTtl) <= 0) {
            throw new IllegalArgumentException("refresh lifetime must exceed access lifetime");
        }
        if (clockSkew.isNegative()) {
            throw new IllegalArgumentException("clock skew must not be negative");
        }
    }

    @Override
    public String toString() {
        return "TokenSettings[issuer=%s, accessTtl=%s, refreshTtl=%s, clockSkew=%s]"
                .formatted(issuer, accessTtl, refreshTtl, clockSkew);
    }
}
