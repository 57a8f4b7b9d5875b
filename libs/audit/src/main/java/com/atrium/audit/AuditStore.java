package com.atrium.audit;

import java.util.List;

/**
 * Append-only persistence for audit entries.
 * <p>
 * {@link #append} runs inside the caller's unit of work: if the surrounding mutation rolls
 * back, the entry disappears with it, and an append failure must roll the mutation back.
 */
public interface AuditStore {

    void append(AuditEntry entry);

    /**
     * Entries of one tenant, newest first.
     *
     * @param limit  maximum number of entries
     * @param offset number of newest entries to skip
     */
    List<AuditEntry> findByTenant(long tenantId, int limit, int offset);
}
