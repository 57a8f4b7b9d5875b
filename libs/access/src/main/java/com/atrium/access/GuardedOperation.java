package com.atrium.access;

import com.atrium.security.Principal;
import com.atrium.security.ResourceMeta;

/**
 * Business code run by {@link RequestPipeline} once the caller is authorized.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface GuardedOperation<T> {

    /**
     * @param principal the authorized caller
     * @param resource  metadata the decision was made on; for creations, the tenant and
     *                  owner to stamp on the new entity
     */
    Effect<T> execute(Principal principal, ResourceMeta resource);
}
