package com.atrium.identity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.argon2.Argon2PasswordEncoder;

/**
 * {@link CredentialVerifier} backed by Spring Security's Argon2id encoder (Bouncy Castle).
 * <p>
 * Stored hashes use the PHC string format ({@code $argon2id$v=19$m=...}), so the cost
 * parameters travel with each hash and can be raised later without invalidating old ones.
 */
public final class Argon2CredentialVerifier implements CredentialVerifier {

    private static final Logger log = LoggerFactory.getLogger(Argon2CredentialVerifier.class);

    private final Argon2PasswordEncoder encoder;

    public Argon2CredentialVerifier() {
        this(Argon2Settings.defaults());
    }

    public Argon2CredentialVerifier(Argon2Settings settings) {
        this.encoder = new Argon2PasswordEncoder(
                settings.saltLength(),
                settings.hashLength(),
                settings.parallelism(),
                settings.memoryKib(),
                settings.iterations());
    }

    @Override
    public String hash(String plaintext) {
        if (plaintext == null || plaintext.isEmpty()) {
            throw new IllegalArgumentException("secret must not be null or empty");
        }
        return encoder.encode(plaintext);
    }

    @Override
    public boolean verify(String plaintext, String storedHash) {
        if (plaintext == null || storedHash == null || storedHash.isBlank()) {
            return false;
        }
        try {
            return encoder.matches(plaintext, storedHash);
        } catch (RuntimeException e) {
            log.warn("Credential verification failed closed: {}", e.getClass().getSimpleName());
            return false;
        }
    }
}
