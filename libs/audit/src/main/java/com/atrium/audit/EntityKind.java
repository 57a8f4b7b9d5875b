package com.atrium.audit;

import com.fasterxml.jackson.annotation.JsonValue;

/** Kinds of tenant-scoped entities whose mutations are audited. */
public enum EntityKind {
    ORGANIZATION("organization"),
    USER("user"),
    PROJECT("project"),
    TAG("tag");

    private final String value;

    EntityKind(String value) {
        this.value = value;
    }

    /** Lower-case name used in audit records and error messages (e.g. "project"). */
    @JsonValue
    public String value() {
        return value;
    }
}
