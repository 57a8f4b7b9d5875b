package com.atrium.access;

import com.atrium.audit.EntityRef;

/**
 * What a guarded operation acts on.
 * <ul>
 *   <li>{@link #entity(EntityRef)}: an existing entity, whose tenant and owner are loaded
 *       from storage;</li>
 *   <li>{@link #creation()}: a new entity, owned by the caller in the caller's tenant;</li>
 *   <li>{@link #tenant()}: the caller's tenant as a whole (listings, tenant settings).</li>
 * </ul>
 */
public final class Target {

    enum Scope { ENTITY, CREATION, TENANT }

    private static final Target CREATION = new Target(Scope.CREATION, null);
    private static final Target TENANT = new Target(Scope.TENANT, null);

    private final Scope scope;
    private final EntityRef entity;

    private Target(Scope scope, EntityRef entity) {
        this.scope = scope;
        this.entity = entity;
    }

    public static Target entity(EntityRef entity) {
        if (entity == null) {
            throw new IllegalArgumentException("entity must not be null");
        }
        return new Target(Scope.ENTITY, entity);
    }

    public static Target creation() {
        return CREATION;
    }

    public static Target tenant() {
        return TENANT;
    }

    Scope scope() {
        return scope;
    }

    /** The referenced entity, or null unless this is an entity target. */
    public EntityRef entityRef() {
        return entity;
    }

    @Override
    public String toString() {
        return scope == Scope.ENTITY ? entity.toString() : scope.name().toLowerCase();
    }
}
