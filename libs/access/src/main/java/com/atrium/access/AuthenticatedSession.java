package com.atrium.access;

import com.atrium.identity.TokenPair;
import com.atrium.security.Principal;

/**
 * Result of a successful login, registration or refresh.
 *
 * @param principal the user the tokens were issued to
 * @param tokens    fresh access and refresh tokens
 */
public record AuthenticatedSession(Principal principal, TokenPair tokens) {
}
