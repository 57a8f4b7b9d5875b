package com.atrium.audit;

/**
 * Points at a single entity instance.
 *
 * @param kind the kind of entity
 * @param id   the entity's id within its kind
 */
public record EntityRef(EntityKind kind, long id) {

    public EntityRef {
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
    }

    public static EntityRef of(EntityKind kind, long id) {
        return new EntityRef(kind, id);
    }

    @Override
    public String toString() {
        return kind.value() + ":" + id;
    }
}
