package com.atrium.access;

import com.atrium.audit.AuditAction;
import com.atrium.audit.EntityRef;

/**
 * What a guarded operation did: its return value and, for mutations, which entity changed.
 *
 * @param value       the operation's result
 * @param auditAction the mutation performed, or null for reads
 * @param changed     the changed entity, or null for reads
 * @param <T>         result type
 */
public record Effect<T>(T value, AuditAction auditAction, EntityRef changed) {

    public Effect {
        if ((auditAction == null) != (changed == null)) {
            throw new IllegalArgumentException("a mutation needs both an action and an entity");
        }
    }

    public static <T> Effect<T> read(T value) {
        return new Effect<>(value, null, null);
    }

    public static <T> Effect<T> mutation(T value, AuditAction auditAction, EntityRef changed) {
        if (auditAction == null) {
            throw new IllegalArgumentException("auditAction must not be null");
        }
        return new Effect<>(value, auditAction, changed);
    }

    public boolean isMutation() {
        return auditAction != null;
    }
}
