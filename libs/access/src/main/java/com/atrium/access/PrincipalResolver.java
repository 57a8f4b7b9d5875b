package com.atrium.access;

import com.atrium.access.spi.UserDirectory;
import com.atrium.identity.TokenClaims;
import com.atrium.identity.TokenCodec;
import com.atrium.identity.TokenKind;
import com.atrium.observability.CorrelationContextHolder;
import com.atrium.observability.MetricFactory;
import com.atrium.observability.SensitiveDataRedactor;
import com.atrium.security.InvalidTokenException;
import com.atrium.security.Principal;
import com.atrium.security.UnauthenticatedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns an access token into the {@link Principal} for the current request.
 * <p>
 * Role and tenant come from the token. Only the user's existence is checked against
 * storage; a role change takes effect when the caller's access token is next refreshed.
 */
public class PrincipalResolver {

    private static final Logger log = LoggerFactory.getLogger(PrincipalResolver.class);

    private static final SensitiveDataRedactor REDACTOR = new SensitiveDataRedactor();

    private final TokenCodec codec;
    private final UserDirectory users;
    private final MetricFactory metrics;

    public PrincipalResolver(TokenCodec codec, UserDirectory users, MetricFactory metrics) {
        this.codec = codec;
        this.users = users;
        this.metrics = metrics;
    }

    /**
     * @param accessToken the bare token (no scheme prefix); may be null
     * @throws UnauthenticatedException if the token is missing or invalid, or its user is gone
     */
    public Principal resolve(String accessToken) {
        if (accessToken == null || accessToken.isBlank()) {
            metrics.recordAuthAttempt("resolve", "missing");
            throw new UnauthenticatedException("Missing access token");
        }

        TokenClaims claims;
        try {
            claims = codec.parse(accessToken, TokenKind.ACCESS);
        } catch (InvalidTokenException e) {
            log.warn("Access token {} rejected: {}",
                    SensitiveDataRedactor.maskToken(accessToken), REDACTOR.scrub(e.getMessage()));
            metrics.recordAuthAttempt("resolve", "invalid_token");
            throw new UnauthenticatedException("Invalid or expired access token", e);
        }

        if (users.findById(claims.userId()).isEmpty()) {
            log.warn("Access token for unknown user {}", claims.userId());
            metrics.recordAuthAttempt("resolve", "unknown_user");
            throw new UnauthenticatedException("Invalid or expired access token");
        }

        Principal principal = new Principal(claims.userId(), claims.tenantId(), claims.role());
        CorrelationContextHolder.bindCaller(principal.tenantId(), principal.userId());
        metrics.recordAuthAttempt("resolve", "success");
        return principal;
    }
}
