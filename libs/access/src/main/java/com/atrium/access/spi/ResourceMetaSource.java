package com.atrium.access.spi;

import com.atrium.audit.EntityRef;
import com.atrium.security.ResourceMeta;

import java.util.Optional;

/** Looks up tenant and owner of a stored entity. */
public interface ResourceMetaSource {

    /**
     * @param entity   the entity to look up
     * @param tenantId the caller's tenant; implementations may use it to narrow the lookup
     * @return the entity's metadata, or empty when it does not exist (for this tenant)
     */
    Optional<ResourceMeta> load(EntityRef entity, long tenantId);
}
