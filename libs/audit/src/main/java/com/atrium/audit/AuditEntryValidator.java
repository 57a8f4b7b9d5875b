package com.atrium.audit;

import java.util.ArrayList;

/**
 * Checks an {@link AuditEntry} for required fields before it is appended.
 * Reports every problem at once.
 */
public final class AuditEntryValidator {

    private AuditEntryValidator() {
        // utility class
    }

    public static ValidationResult validate(AuditEntry entry) {
        var errors = new ArrayList<String>();

        if (entry.entryId() == null || entry.entryId().isBlank()) {
            errors.add("entryId must not be null or blank");
        }
        if (entry.actorUserId() <= 0) {
            errors.add("actorUserId must be positive");
        }
        if (entry.tenantId() <= 0) {
            errors.add("tenantId must be positive");
        }
        if (entry.action() == null) {
            errors.add("action must not be null");
        }
        if (entry.entityKind() == null) {
            errors.add("entityKind must not be null");
        }
        if (entry.entityId() <= 0) {
            errors.add("entityId must be positive");
        }
        if (entry.occurredAt() == null) {
            errors.add("occurredAt must not be null");
        }

        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }
}
