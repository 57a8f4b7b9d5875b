package com.atrium.security;

/**
 * A uniqueness rule was violated.
 */
public class ConflictException extends AccessException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public Failure failure() {
        return Failure.CONFLICT;
    }
}
