package com.atrium.identity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.atrium.security.Failure;
import com.atrium.security.InvalidTokenException;
import com.atrium.security.Role;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("TokenCodec")
class TokenCodecTest {

    private static final String SECRET = "test-signing-secret-0123456789-abcdef";
    private static final Instant T0 = Instant.parse("2026-01-15T10:00:00Z");

    private static final TokenSettings SETTINGS = new TokenSettings(SECRET, null, null, null, null);

    private final TokenCodec codec = new TokenCodec(SETTINGS, fixedAt(T0));

    private static Clock fixedAt(Instant instant) {
        return Clock.fixed(instant, ZoneOffset.UTC);
    }

    @Nested
    @DisplayName("access tokens")
    class AccessTokens {

        @Test
        @DisplayName("round-trip recovers user, tenant and role with a future expiry")
        void roundTrip() {
            String token = codec.issueAccess(42L, 7L, Role.EDITOR);

            TokenClaims claims = codec.parse(token, TokenKind.ACCESS);

            assertThat(claims.kind()).isEqualTo(TokenKind.ACCESS);
            assertThat(claims.userId()).isEqualTo(42L);
            assertThat(claims.tenantId()).isEqualTo(7L);
            assertThat(claims.role()).isEqualTo(Role.EDITOR);
            assertThat(claims.expiresAt()).isAfter(T0).isEqualTo(T0.plus(Duration.ofMinutes(30)));
            assertThat(claims.tokenId()).isNotBlank();
        }

        @Test
        @DisplayName("round-trips every role")
        void everyRole() {
            for (Role role : Role.values()) {
                assertThat(codec.parse(codec.issueAccess(1L, 2L, role), TokenKind.ACCESS).role()).isEqualTo(role);
            }
        }

        @Test
        @DisplayName("is rejected once expired")
        void expired() {
            String token = codec.issueAccess(42L, 7L, Role.ADMIN);
            var later = new TokenCodec(SETTINGS, fixedAt(T0.plus(Duration.ofMinutes(31))));

            assertThatThrownBy(() -> later.parse(token, TokenKind.ACCESS))
                    .isInstanceOf(InvalidTokenException.class)
                    .hasMessageContaining("expired");
        }

        @Test
        @DisplayName("is accepted just before expiry")
        void justBeforeExpiry() {
            String token = codec.issueAccess(42L, 7L, Role.ADMIN);
            var later = new TokenCodec(SETTINGS, fixedAt(T0.plus(Duration.ofMinutes(29))));

            assertThat(later.parse(token, TokenKind.ACCESS).userId()).isEqualTo(42L);
        }

        @Test
        @DisplayName("is rejected where a refresh token is expected")
        void wrongKind() {
            String token = codec.issueAccess(42L, 7L, Role.ADMIN);

            assertThatThrownBy(() -> codec.parse(token, TokenKind.REFRESH))
                    .isInstanceOf(InvalidTokenException.class)
                    .hasMessageContaining("expected a refresh token");
        }
    }

    @Nested
    @DisplayName("refresh tokens")
    class RefreshTokens {

        @Test
        @DisplayName("carry the subject only and live for seven days")
        void subjectOnly() {
            TokenClaims claims = codec.parse(codec.issueRefresh(42L), TokenKind.REFRESH);

            assertThat(claims.userId()).isEqualTo(42L);
            assertThat(claims.tenantId()).isNull();
            assertThat(claims.role()).isNull();
            assertThat(claims.expiresAt()).isEqualTo(T0.plus(Duration.ofDays(7)));
        }

        @Test
        @DisplayName("are rejected where an access token is expected")
        void wrongKind() {
            String token = codec.issueRefresh(42L);

            assertThatThrownBy(() -> codec.parse(token, TokenKind.ACCESS))
                    .isInstanceOfSatisfying(InvalidTokenException.class,
                            e -> assertThat(e.failure()).isEqualTo(Failure.INVALID_TOKEN));
        }

        @Test
        @DisplayName("two refresh tokens for the same user differ")
        void uniqueIds() {
            assertThat(codec.issueRefresh(42L)).isNotEqualTo(codec.issueRefresh(42L));
        }
    }

    @Nested
    @DisplayName("issuePair()")
    class IssuePair {

        @Test
        @DisplayName("issues both kinds with their own expiries")
        void pair() {
            TokenPair pair = codec.issuePair(5L, 9L, Role.VIEWER);

            assertThat(codec.parse(pair.accessToken(), TokenKind.ACCESS).tenantId()).isEqualTo(9L);
            assertThat(codec.parse(pair.refreshToken(), TokenKind.REFRESH).userId()).isEqualTo(5L);
            assertThat(pair.accessTokenExpiresAt()).isEqualTo(T0.plus(Duration.ofMinutes(30)));
            assertThat(pair.refreshTokenExpiresAt()).isEqualTo(T0.plus(Duration.ofDays(7)));
        }

        @Test
        @DisplayName("toString() does not print the tokens")
        void toStringHidesTokens() {
            TokenPair pair = codec.issuePair(5L, 9L, Role.VIEWER);

            assertThat(pair.toString()).doesNotContain(pair.accessToken()).doesNotContain(pair.refreshToken());
        }
    }

    @Nested
    @DisplayName("rejection")
    class Rejection {

        @Test
        @DisplayName("token signed with another secret")
        void foreignSignature() {
            var other = new TokenCodec(
                    new TokenSettings("another-signing-secret-0123456789-xyz", null, null, null, null), fixedAt(T0));
            String token = other.issueAccess(42L, 7L, Role.ADMIN);

            assertThatThrownBy(() -> codec.parse(token, TokenKind.ACCESS))
                    .isInstanceOf(InvalidTokenException.class);
        }

        @Test
        @DisplayName("tampered payload")
        void tampered() {
            String token = codec.issueAccess(42L, 7L, Role.VIEWER);
            String[] parts = token.split("\\.");
            String forgedPayload = java.util.Base64.getUrlEncoder().withoutPadding().encodeToString(
                    "{\"sub\":\"42\",\"type\":\"access\",\"tenant_id\":\"7\",\"role\":\"admin\"}"
                            .getBytes(StandardCharsets.UTF_8));

            assertThatThrownBy(() -> codec.parse(parts[0] + "." + forgedPayload + "." + parts[2], TokenKind.ACCESS))
                    .isInstanceOf(InvalidTokenException.class);
        }

        @Test
        @DisplayName("garbage, empty and null input")
        void garbage() {
            assertThatThrownBy(() -> codec.parse("this-is-not-a-valid-jwt-token", TokenKind.ACCESS))
                    .isInstanceOf(InvalidTokenException.class);
            assertThatThrownBy(() -> codec.parse("", TokenKind.ACCESS))
                    .isInstanceOf(InvalidTokenException.class);
            assertThatThrownBy(() -> codec.parse(null, TokenKind.ACCESS))
                    .isInstanceOf(InvalidTokenException.class);
        }

        @Test
        @DisplayName("correctly signed token without the required claims")
        void missingClaims() {
            String token = Jwts.builder()
                    .subject("42")
                    .issuer(TokenSettings.DEFAULT_ISSUER)
                    .claim("type", "access")
                    .issuedAt(Date.from(T0))
                    .expiration(Date.from(T0.plusSeconds(600)))
                    .signWith(Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8)))
                    .compact();

            assertThatThrownBy(() -> codec.parse(token, TokenKind.ACCESS))
                    .isInstanceOf(InvalidTokenException.class)
                    .hasMessageContaining("tenant_id")
                    .hasMessageContaining("role")
                    .hasMessageContaining("jti");
        }

        @Test
        @DisplayName("token without expiry")
        void missingExpiry() {
            String token = Jwts.builder()
                    .id("jti-1")
                    .subject("42")
                    .issuer(TokenSettings.DEFAULT_ISSUER)
                    .claim("type", "refresh")
                    .issuedAt(Date.from(T0))
                    .signWith(Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8)))
                    .compact();

            assertThatThrownBy(() -> codec.parse(token, TokenKind.REFRESH))
                    .isInstanceOf(InvalidTokenException.class)
                    .hasMessageContaining("exp");
        }

        @Test
        @DisplayName("token from another issuer")
        void otherIssuer() {
            var foreign = new TokenCodec(
                    new TokenSettings(SECRET, "someone-else", null, null, null), fixedAt(T0));

            assertThatThrownBy(() -> codec.parse(foreign.issueAccess(1L, 1L, Role.ADMIN), TokenKind.ACCESS))
                    .isInstanceOf(InvalidTokenException.class);
        }
    }
}
