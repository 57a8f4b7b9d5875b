package com.atrium.portfolio.domain;

import java.time.Instant;

/**
 * A tenant. Its id is the tenant id carried in access tokens and stamped on every entity
 * the organization owns.
 */
public record Organization(long id, String name, Instant createdAt) {}
