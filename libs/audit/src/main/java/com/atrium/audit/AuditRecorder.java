package com.atrium.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Writes audit entries for successful mutations and reads a tenant's trail back.
 * <p>
 * {@link #record} belongs inside the mutation's unit of work. {@link #publish} is called
 * once that unit of work has committed and copies the entry, as one JSON line, to the
 * {@value #AUDIT_LOGGER} logger.
 */
public class AuditRecorder {

    public static final String AUDIT_LOGGER = "atrium.audit";

    private static final Logger log = LoggerFactory.getLogger(AuditRecorder.class);
    private static final Logger auditLog = LoggerFactory.getLogger(AUDIT_LOGGER);

    private final AuditStore store;
    private final AuditEntryFactory factory;

    public AuditRecorder(AuditStore store, AuditEntryFactory factory) {
        this.store = store;
        this.factory = factory;
    }

    /**
     * Builds, validates and appends one entry.
     *
     * @throws IllegalArgumentException if the entry would be incomplete
     */
    public AuditEntry record(long actorUserId, long tenantId, AuditAction action, EntityRef entity) {
        if (action == null || entity == null) {
            throw new IllegalArgumentException("action and entity are required");
        }
        AuditEntry entry = factory.create(actorUserId, tenantId, action, entity);
        ValidationResult result = AuditEntryValidator.validate(entry);
        if (!result.valid()) {
            throw new IllegalArgumentException("Invalid audit entry: " + String.join("; ", result.errors()));
        }
        store.append(entry);
        log.debug("Recorded {} on {} by user {}", entry.qualifiedAction(), entity, actorUserId);
        return entry;
    }

    public void publish(AuditEntry entry) {
        if (auditLog.isInfoEnabled()) {
            auditLog.info(AuditEntrySerializer.serialize(entry));
        }
    }

    /** A tenant's entries, newest first. */
    public List<AuditEntry> history(long tenantId, int limit, int offset) {
        if (limit < 1 || offset < 0) {
            throw new IllegalArgumentException("limit must be >= 1 and offset >= 0");
        }
        return store.findByTenant(tenantId, limit, offset);
    }
}
