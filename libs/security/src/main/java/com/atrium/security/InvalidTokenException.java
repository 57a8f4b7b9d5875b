package com.atrium.security;

/**
 * A token failed verification: bad signature, expired, missing claims or wrong kind.
 */
public class InvalidTokenException extends AccessException {

    public InvalidTokenException(String message) {
        super(message);
    }

    public InvalidTokenException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public Failure failure() {
        return Failure.INVALID_TOKEN;
    }
}
