package com.atrium.audit;

import java.time.Instant;

/**
 * One immutable line of the audit trail: who did what to which entity, in which tenant.
 * <p>
 * Entries are appended in the same unit of work as the mutation they describe and are
 * never updated or deleted afterwards.
 *
 * @param entryId       unique id of this entry (UUID)
 * @param actorUserId   the user who performed the mutation
 * @param tenantId      the tenant the entity belongs to (always the actor's tenant)
 * @param action        what happened
 * @param entityKind    kind of the affected entity
 * @param entityId      id of the affected entity
 * @param occurredAt    when the mutation was committed
 * @param correlationId request correlation id, or null outside a request
 */
public record AuditEntry(
        String entryId,
        long actorUserId,
        long tenantId,
        AuditAction action,
        EntityKind entityKind,
        long entityId,
        Instant occurredAt,
        String correlationId
) {

    /** e.g. {@code project.delete}. */
    public String qualifiedAction() {
        return action.qualifiedName(entityKind);
    }

    public EntityRef entity() {
        return new EntityRef(entityKind, entityId);
    }
}
