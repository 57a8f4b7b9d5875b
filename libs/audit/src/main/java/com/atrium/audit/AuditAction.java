package com.atrium.audit;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What happened to the entity. Combined with {@link EntityKind} this gives the qualified
 * action name shown in the activity feed, e.g. {@code project.delete}.
 */
public enum AuditAction {
    CREATE("create"),
    UPDATE("update"),
    DELETE("delete");

    private final String value;

    AuditAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** {@code <entity kind>.<action>}, e.g. {@code tag.create}. */
    public String qualifiedName(EntityKind kind) {
        return kind.value() + "." + value;
    }
}
