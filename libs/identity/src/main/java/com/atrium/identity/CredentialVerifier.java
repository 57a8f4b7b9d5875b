package com.atrium.identity;

/**
 * Hash-and-verify capability for user passwords.
 * <p>
 * Implementations must salt every hash freshly, so two hashes of the same password never
 * match, and must fail closed: any problem during verification means "no match".
 */
public interface CredentialVerifier {

    /**
     * Hashes a plaintext secret for storage. Used at registration and user creation only.
     *
     * @throws IllegalArgumentException if the secret is null or empty
     */
    String hash(String plaintext);

    /**
     * Checks a submitted secret against a stored hash.
     *
     * @return true only if the secret matches; false for null input, a malformed hash or
     *         any internal error
     */
    boolean verify(String plaintext, String storedHash);
}
