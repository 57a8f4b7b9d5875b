package com.atrium.identity;

/**
 * Cost parameters of the Argon2id password hash.
 *
 * @param saltLength  salt length in bytes
 * @param hashLength  derived hash length in bytes
 * @param parallelism lanes
 * @param memoryKib   memory cost in KiB
 * @param iterations  time cost
 */
public record Argon2Settings(int saltLength, int hashLength, int parallelism, int memoryKib, int iterations) {

    public Argon2Settings {
        if (saltLength < 8 || hashLength < 16) {
            throw new IllegalArgumentException("salt must be >= 8 bytes and hash >= 16 bytes");
        }
        if (parallelism < 1 || iterations < 1) {
            throw new IllegalArgumentException("parallelism and iterations must be positive");
        }
        if (memoryKib < 8 * parallelism) {
            throw new IllegalArgumentException("memory must be at least 8 KiB per lane");
        }
    }

    /** Argon2id parameters recommended for interactive logins (19 MiB, 2 passes, 1 lane). */
    public static Argon2Settings defaults() {
        return new Argon2Settings(16, 32, 1, 19_456, 2);
    }
}
