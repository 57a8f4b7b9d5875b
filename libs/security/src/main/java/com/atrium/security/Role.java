package com.atrium.security;

import java.util.Optional;

/**
 * Roles a user can hold inside one organization.
 * <p>
 * The set is closed. Roles carry no implied hierarchy: what each role may do is listed
 * explicitly in {@link CapabilityTable}, so a new role never inherits another role's
 * exemptions by accident.
 */
public enum Role {

    ADMIN("admin"),
    EDITOR("editor"),
    VIEWER("viewer");

    private final String value;

    Role(String value) {
        this.value = value;
    }

    /** The canonical string representation used in tokens and API payloads (e.g., "editor"). */
    public String value() {
        return value;
    }

    /**
     * Looks up a Role by its canonical string value.
     *
     * @return the matching Role, or empty if the value is null or unknown
     */
    public static Optional<Role> fromString(String value) {
        for (Role role : values()) {
            if (role.value.equals(value)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }

    /**
     * Checks whether a string corresponds to a known role.
     */
    public static boolean isKnown(String value) {
        return fromString(value).isPresent();
    }
}
