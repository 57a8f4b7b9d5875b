package com.atrium.identity;

import com.atrium.security.Role;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Checks that a signature-verified claim set has every claim its kind requires.
 * <p>
 * Returns all problems at once; an empty list means the claim set is complete. A token whose {@code type} differs from the expected kind
 * fails here, so a refresh token can never pass as an access token or the other way round.
 */
public final class ClaimsValidator {

    static final String SUBJECT = "sub";
    static final String TYPE = "type";
    static final String TENANT = "tenant_id";
    static final String ROLE = "role";
    static final String ISSUED_AT = "iat";
    static final String EXPIRATION = "exp";
    static final String TOKEN_ID = "jti";

    private ClaimsValidator() {
        // utility class
    }

    /**
     * @param claims   the verified claim set
     * @param expected the kind the calling operation accepts
     * @return the problems found, empty when the claims are valid
     */
    public static List<String> validate(Map<String, ?> claims, TokenKind expected) {
        List<String> errors = new ArrayList<>();

        Object type = claims.get(TYPE);
        if (type == null) {
            errors.add("type claim is missing");
        } else if (!expected.value().equals(type)) {
            errors.add("expected a %s token but got '%s'".formatted(expected.value(), type));
        }

        if (!isNumeric(claims.get(SUBJECT))) {
            errors.add("sub must be a numeric user id");
        }
        if (claims.get(EXPIRATION) == null) {
            errors.add("exp claim is missing");
        }
        if (claims.get(ISSUED_AT) == null) {
            errors.add("iat claim is missing");
        }
        if (isBlank(claims.get(TOKEN_ID))) {
            errors.add("jti claim is missing");
        }

        if (expected == TokenKind.ACCESS) {
            if (!isNumeric(claims.get(TENANT))) {
                errors.add("tenant_id must be a numeric tenant id");
            }
            Object role = claims.get(ROLE);
            if (!(role instanceof String) || !Role.isKnown((String) role)) {
                errors.add("role claim is missing or unknown");
            }
        } else {
            if (claims.containsKey(TENANT) || claims.containsKey(ROLE)) {
                errors.add("refresh tokens must not carry tenant or role claims");
            }
        }

        return List.copyOf(errors);
    }

    private static boolean isNumeric(Object value) {
        if (!(value instanceof String) || ((String) value).isEmpty()) {
            return false;
        }
        try {
            Long.parseLong((String) value);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static boolean isBlank(Object value) {
        return value == null || value.toString().isBlank();
    }
}
