package com.atrium.security;

/**
 * Caller-visible failure kinds of the access layer. The request-handling layer maps each
 * kind to its transport status; none of them is retried.
 */
public enum Failure {
    /** Login with an unknown email or a wrong password. */
    INVALID_CREDENTIALS,
    /** Token is malformed, badly signed, expired, incomplete or of the wrong kind. */
    INVALID_TOKEN,
    /** No principal could be resolved for the request. */
    UNAUTHENTICATED,
    /** Principal resolved but the evaluator denied the action. */
    FORBIDDEN,
    /** Resource absent or owned by another tenant (indistinguishable). */
    NOT_FOUND,
    /** Uniqueness violation (duplicate email, organization name or tag). */
    CONFLICT
}
