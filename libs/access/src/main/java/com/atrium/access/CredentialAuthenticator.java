package com.atrium.access;

import com.atrium.access.spi.UserAccount;
import com.atrium.access.spi.UserDirectory;
import com.atrium.identity.CredentialVerifier;
import com.atrium.identity.TokenClaims;
import com.atrium.identity.TokenCodec;
import com.atrium.identity.TokenKind;
import com.atrium.identity.TokenPair;
import com.atrium.observability.MetricFactory;
import com.atrium.observability.SensitiveDataRedactor;
import com.atrium.security.InvalidCredentialsException;
import com.atrium.security.InvalidTokenException;
import com.atrium.security.Principal;
import com.atrium.security.UnauthenticatedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Login and token refresh.
 * <p>
 * Keeps no state between attempts: there is no failure counter and no lockout. An unknown
 * email is still checked against a dummy hash so both failure paths cost one Argon2
 * verification and produce the same {@link InvalidCredentialsException}.
 */
public class CredentialAuthenticator {

    private static final Logger log = LoggerFactory.getLogger(CredentialAuthenticator.class);

    private static final SensitiveDataRedactor REDACTOR = new SensitiveDataRedactor();

    static final String INVALID_CREDENTIALS = "Invalid email or password";

    private final UserDirectory users;
    private final CredentialVerifier verifier;
    private final TokenCodec codec;
    private final MetricFactory metrics;
    private final String dummyHash;

    public CredentialAuthenticator(UserDirectory users, CredentialVerifier verifier, TokenCodec codec,
                                   MetricFactory metrics) {
        this.users = users;
        this.verifier = verifier;
        this.codec = codec;
        this.metrics = metrics;
        this.dummyHash = verifier.hash(UUID.randomUUID().toString());
    }

    /**
     * @throws InvalidCredentialsException if the email is unknown or the password is wrong
     */
    public AuthenticatedSession authenticate(String email, String password) {
        Optional<UserAccount> account = users.findByEmail(normalizeEmail(email));

        String hash = account.map(UserAccount::passwordHash).orElse(dummyHash);
        boolean matches = verifier.verify(password, hash);

        if (account.isEmpty() || !matches) {
            log.warn("Login failed{}", account.map(a -> " for user " + a.id()).orElse(" for unknown email"));
            metrics.recordAuthAttempt("login", "failure");
            throw new InvalidCredentialsException(INVALID_CREDENTIALS);
        }

        metrics.recordAuthAttempt("login", "success");
        return issueFor(account.get());
    }

    /**
     * Exchanges a refresh token for a new pair. Role and tenant are re-read from storage.
     *
     * @throws InvalidTokenException    if the token is not a valid refresh token
     * @throws UnauthenticatedException if the user no longer exists
     */
    public AuthenticatedSession refresh(String refreshToken) {
        TokenClaims claims;
        try {
            claims = codec.parse(refreshToken, TokenKind.REFRESH);
        } catch (InvalidTokenException e) {
            log.warn("Refresh token {} rejected: {}",
                    SensitiveDataRedactor.maskToken(refreshToken), REDACTOR.scrub(e.getMessage()));
            metrics.recordAuthAttempt("refresh", "invalid_token");
            throw e;
        }

        UserAccount account = users.findById(claims.userId()).orElseThrow(() -> {
            metrics.recordAuthAttempt("refresh", "unknown_user");
            return new UnauthenticatedException("User no longer exists");
        });

        metrics.recordAuthAttempt("refresh", "success");
        return issueFor(account);
    }

    /** Issues a fresh pair for an already authenticated or just created account. */
    public AuthenticatedSession issueFor(UserAccount account) {
        Principal principal = account.toPrincipal();
        TokenPair tokens = codec.issuePair(principal.userId(), principal.tenantId(), principal.role());
        return new AuthenticatedSession(principal, tokens);
    }

    /** Trims and lower-cases an email; null stays null. */
    public static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }
}
