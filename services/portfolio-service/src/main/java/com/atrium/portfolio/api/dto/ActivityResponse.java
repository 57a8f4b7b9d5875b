package com.atrium.portfolio.api.dto;

import com.atrium.audit.AuditEntry;
import java.time.Instant;

/** One audit entry as shown in the activity feed; {@code action} is e.g. {@code project.delete}. */
public record ActivityResponse(
        String id, String action, String entity, long entityId, long actorUserId, Instant createdAt) {

    public static ActivityResponse from(AuditEntry entry) {
        return new ActivityResponse(
                entry.entryId(),
                entry.qualifiedAction(),
                entry.entityKind().value(),
                entry.entityId(),
                entry.actorUserId(),
                entry.occurredAt());
    }
}
