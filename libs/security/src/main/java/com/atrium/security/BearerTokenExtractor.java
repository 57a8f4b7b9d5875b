package com.atrium.security;

import java.util.Locale;
import java.util.Optional;

/**
 * Extracts the bearer token from an HTTP Authorization header value.
 */
public final class BearerTokenExtractor {

    private static final String SCHEME = "bearer";

    private BearerTokenExtractor() {
        // utility class
    }

    /**
     * Expects {@code "Bearer <token>"}; the scheme is matched case-insensitively and must be
     * separated from the token by whitespace. A token containing whitespace is rejected.
     *
     * @param authorizationHeader the full header value (may be null)
     * @return the token, or empty if the header is missing, uses another scheme or is malformed
     */
    public static Optional<String> extract(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            return Optional.empty();
        }
        String[] parts = authorizationHeader.strip().split("\\s+");
        if (parts.length != 2 || !SCHEME.equals(parts[0].toLowerCase(Locale.ROOT))) {
            return Optional.empty();
        }
        return Optional.of(parts[1]);
    }

    /**
     * Same as {@link #extract(String)} but fails when no token is present.
     *
     * @throws UnauthenticatedException if the header carries no bearer token
     */
    public static String require(String authorizationHeader) {
        return extract(authorizationHeader)
                .orElseThrow(() -> new UnauthenticatedException("Missing bearer token"));
    }
}
