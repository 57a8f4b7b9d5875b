package com.atrium.security;

/**
 * No principal could be resolved. Raised before any resource lookup.
 */
public class UnauthenticatedException extends AccessException {

    public UnauthenticatedException(String message) {
        super(message);
    }

    public UnauthenticatedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public Failure failure() {
        return Failure.UNAUTHENTICATED;
    }
}
