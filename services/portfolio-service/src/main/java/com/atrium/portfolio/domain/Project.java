package com.atrium.portfolio.domain;

import com.atrium.security.ResourceMeta;
import java.time.Instant;
import java.util.List;

/**
 * A portfolio project. Tenant and owner are fixed at creation.
 *
 * @param tagIds ids of the project's tags, all in the same tenant
 */
public record Project(
        long id,
        long tenantId,
        long ownerUserId,
        String title,
        String description,
        String githubUrl,
        boolean isPublic,
        List<Long> tagIds,
        Instant createdAt,
        Instant updatedAt) {

    public Project {
        tagIds = List.copyOf(tagIds);
    }

    public ResourceMeta meta() {
        return ResourceMeta.owned(tenantId, ownerUserId);
    }
}
