package com.atrium.security;

/**
 * Login rejected. Unknown email and wrong password are reported identically.
 */
public class InvalidCredentialsException extends AccessException {

    public InvalidCredentialsException(String message) {
        super(message);
    }

    public InvalidCredentialsException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public Failure failure() {
        return Failure.INVALID_CREDENTIALS;
    }
}
