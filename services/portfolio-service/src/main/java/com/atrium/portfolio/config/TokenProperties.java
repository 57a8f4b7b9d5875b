package com.atrium.portfolio.config;

import com.atrium.identity.TokenSettings;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Token signing and lifetimes, bound from {@code atrium.security.token.*}.
 *
 * <p>The secret is normally supplied through {@code ATRIUM_TOKEN_SECRET}. Startup fails when it
 * is missing or shorter than {@value TokenSettings#MIN_SECRET_BYTES} bytes.
 *
 * @param secret HMAC signing secret. Required.
 * @param issuer {@code iss} claim (default {@code atrium}).
 * @param accessTtl access token lifetime (default 30m).
 * @param refreshTtl refresh token lifetime (default 7d).
 * @param clockSkew tolerance when checking expiry (default 0s).
 */
@ConfigurationProperties(prefix = "atrium.security.token")
@Validated
public record TokenProperties(
        @NotBlank String secret,
        String issuer,
        Duration accessTtl,
        Duration refreshTtl,
        Duration clockSkew) {

    public TokenSettings toSettings() {
        return new TokenSettings(secret, issuer, accessTtl, refreshTtl, clockSkew);
    }

    @Override
    public String toString() {
        return "TokenProperties[issuer=%s, accessTtl=%s, refreshTtl=%s, clockSkew=%s]"
                .formatted(issuer, accessTtl, refreshTtl, clockSkew);
    }
}
