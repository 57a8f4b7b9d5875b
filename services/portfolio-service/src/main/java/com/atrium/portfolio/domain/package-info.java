/**
 * Portfolio domain records: organizations, tags and projects.
 *
 * <p>Users are represented by {@link com.atrium.access.spi.UserAccount}. Every entity carries
 * the id of the organization (tenant) it belongs to.
 */
package com.atrium.portfolio.domain;
