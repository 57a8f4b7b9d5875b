package com.atrium.portfolio.config;

import com.atrium.identity.Argon2Settings;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Argon2id cost parameters, bound from {@code atrium.security.password.*}. Unset or
 * non-positive values fall back to {@link Argon2Settings#defaults()}.
 */
@ConfigurationProperties(prefix = "atrium.security.password")
public record PasswordProperties(
        int saltLength, int hashLength, int parallelism, int memoryKib, int iterations) {

    public PasswordProperties {
        Argon2Settings defaults = Argon2Settings.defaults();
        if (saltLength <= 0) {
            saltLength = defaults.saltLength();
        }
        if (hashLength <= 0) {
            hashLength = defaults.hashLength();
        }
        if (parallelism <= 0) {
            parallelism = defaults.parallelism();
        }
        if (memoryKib <= 0) {
            memoryKib = defaults.memoryKib();
        }
        if (iterations <= 0) {
            iterations = defaults.iterations();
        }
    }

    public Argon2Settings toSettings() {
        return new Argon2Settings(saltLength, hashLength, parallelism, memoryKib, iterations);
    }
}
