package com.atrium.security;

/**
 * The resource does not exist for the caller: either absent or owned by another tenant.
 */
public class NotFoundException extends AccessException {

    public NotFoundException(String message) {
        super(message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Standard message for an entity looked up by kind and id. */
    public static NotFoundException of(String entityKind, long id) {
        return new NotFoundException("%s %d not found".formatted(entityKind, id));
    }

    @Override
    public Failure failure() {
        return Failure.NOT_FOUND;
    }
}
