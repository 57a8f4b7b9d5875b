package com.atrium.audit;

import com.atrium.observability.CorrelationContextHolder;

import java.time.Clock;
import java.util.UUID;

/**
 * Creates {@link AuditEntry} instances, filling in the entry id, the timestamp and the
 * correlation id of the current request.
 */
public final class AuditEntryFactory {

    private final Clock clock;

    public AuditEntryFactory() {
        this(Clock.systemUTC());
    }

    public AuditEntryFactory(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.clock = clock;
    }

    public AuditEntry create(long actorUserId, long tenantId, AuditAction action, EntityRef entity) {
        return new AuditEntry(
                UUID.randomUUID().toString(),
                actorUserId,
                tenantId,
                action,
                entity.kind(),
                entity.id(),
                clock.instant(),
                CorrelationContextHolder.currentCorrelationId()
        );
    }
}
