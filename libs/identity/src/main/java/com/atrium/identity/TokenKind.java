package com.atrium.identity;

/**
 * The two token kinds. An access token authorizes API calls; a refresh token authorizes
 * only token renewal. Neither is accepted where the other is expected.
 */
public enum TokenKind {

    ACCESS("access"),
    REFRESH("refresh");

    private final String value;

    TokenKind(String value) {
        this.value = value;
    }

    /** Value of the {@code type} claim. */
    public String value() {
        return value;
    }
}
