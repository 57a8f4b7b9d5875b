package com.atrium.security;

/**
 * Base of every failure the access layer reports to callers.
 * <p>
 * Unchecked: these are terminal outcomes of a request, not conditions a caller can fix
 * by retrying, and they travel through business code untouched up to the boundary.
 */
public abstract class AccessException extends RuntimeException {

    protected AccessException(String message) {
        super(message);
    }

    protected AccessException(String message, Throwable cause) {
        super(message, cause);
    }

    /** The caller-visible failure kind. */
    public abstract Failure failure();
}
