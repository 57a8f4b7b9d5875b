package com.atrium.identity;

import com.atrium.security.InvalidTokenException;
import com.atrium.security.Role;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.List;
import java.util.UUID;

/**
 * Issues and verifies signed, time-bounded bearer tokens (HMAC-signed JWTs).
 * <p>
 * Access tokens carry subject, tenant and role; refresh tokens carry the subject only.
 * Tokens are signed, not encrypted: nothing beyond identity, tenant and role is ever put
 * in a claim. Signature and expiry are the only trust mechanism; there is no lookup
 * against stored state, so a token stays valid until its {@code exp}.
 * <p>
 * Thread-safe. The signing key is derived once in the constructor.
 */
public final class TokenCodec {

    private static final Logger log = LoggerFactory.getLogger(TokenCodec.class);

    private final TokenSettings settings;
    private final Clock clock;
    private final SecretKey key;
    private final JwtParser parser;

    public TokenCodec(TokenSettings settings) {
        this(settings, Clock.systemUTC());
    }

    /**
     * @param settings signing secret, issuer and lifetimes
     * @param clock    source of "now" for both issuing and expiry checks
     */
    public TokenCodec(TokenSettings settings, Clock clock) {
        if (settings == null || clock == null) {
            throw new IllegalArgumentException("settings and clock are required");
        }
        this.settings = settings;
        this.clock = clock;
        this.key = Keys.hmacShaKeyFor(settings.secret().getBytes(StandardCharsets.UTF_8));
        this.parser = Jwts.parser()
                .verifyWith(key)
                .requireIssuer(settings.issuer())
                .clock(() -> Date.from(clock.instant()))
                .clockSkewSeconds(settings.clockSkew().toSeconds())
                .build();
    }

    /**
     * Issues an access token expiring {@link TokenSettings#accessTtl()} from now.
     */
    public String issueAccess(long userId, long tenantId, Role role) {
        return issueAccess(userId, tenantId, role, clock.instant());
    }

    /**
     * Issues a refresh token expiring {@link TokenSettings#refreshTtl()} from now. It has no
     * tenant or role claim.
     */
    public String issueRefresh(long userId) {
        return issueRefresh(userId, clock.instant());
    }

    /**
     * Issues an access/refresh pair sharing one issue time.
     */
    public TokenPair issuePair(long userId, long tenantId, Role role) {
        Instant now = clock.instant();
        return new TokenPair(
                issueAccess(userId, tenantId, role, now),
                expiry(now, settings.accessTtl()),
                issueRefresh(userId, now),
                expiry(now, settings.refreshTtl()));
    }

    /**
     * Verifies a token and returns its claims.
     *
     * @param token    the compact token string
     * @param expected the kind the calling operation accepts
     * @throws InvalidTokenException if the signature does not verify, the token is expired,
     *                               the issuer differs, claims are missing or the kind is wrong
     */
    public TokenClaims parse(String token, TokenKind expected) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException("Token is empty");
        }
        Claims claims;
        try {
            claims = parser.parseSignedClaims(token).getPayload();
        } catch (ExpiredJwtException e) {
            throw new InvalidTokenException("Token expired", e);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Token rejected: {}", e.getClass().getSimpleName());
            throw new InvalidTokenException("Token rejected", e);
        }

        List<String> errors = ClaimsValidator.validate(claims, expected);
        if (!errors.isEmpty()) {
            throw new InvalidTokenException("Token claims invalid: " + String.join("; ", errors));
        }

        String tenant = claims.get(ClaimsValidator.TENANT, String.class);
        String role = claims.get(ClaimsValidator.ROLE, String.class);
        return new TokenClaims(
                expected,
                Long.parseLong(claims.getSubject()),
                tenant != null ? Long.valueOf(tenant) : null,
                role != null ? Role.fromString(role).orElseThrow() : null,
                claims.getIssuedAt().toInstant(),
                claims.getExpiration().toInstant(),
                claims.getId());
    }

    public TokenSettings settings() {
        return settings;
    }

    private String issueAccess(long userId, long tenantId, Role role, Instant now) {
        if (role == null) {
            throw new IllegalArgumentException("role is required");
        }
        return Jwts.builder()
                .id(UUID.randomUUID().toString())
                .subject(Long.toString(userId))
                .issuer(settings.issuer())
                .claim(ClaimsValidator.TYPE, TokenKind.ACCESS.value())
                .claim(ClaimsValidator.TENANT, Long.toString(tenantId))
                .claim(ClaimsValidator.ROLE, role.value())
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiry(now, settings.accessTtl())))
                .signWith(key)
                .compact();
    }

    private String issueRefresh(long userId, Instant now) {
        return Jwts.builder()
                .id(UUID.randomUUID().toString())
                .subject(Long.toString(userId))
                .issuer(settings.issuer())
                .claim(ClaimsValidator.TYPE, TokenKind.REFRESH.value())
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiry(now, settings.refreshTtl())))
                .signWith(key)
                .compact();
    }

    // JWT dates have second precision; truncate so the reported expiry matches the claim.
    private static Instant expiry(Instant issuedAt, Duration ttl) {
        return issuedAt.plus(ttl).truncatedTo(ChronoUnit.SECONDS);
    }
}
