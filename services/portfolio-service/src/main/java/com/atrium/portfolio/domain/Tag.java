package com.atrium.portfolio.domain;

import java.util.Locale;

/** A label scoped to one organization. Names are stored trimmed and lower-cased. */
public record Tag(long id, long tenantId, String name) {

    /** Canonical form of a tag name: trimmed, lower-case. */
    public static String normalize(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }
}
