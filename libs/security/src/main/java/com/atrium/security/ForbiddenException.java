package com.atrium.security;

/**
 * The evaluator denied the action. The deny reason is kept for logs and metrics; the
 * message shown to callers never includes it.
 */
public class ForbiddenException extends AccessException {

    private final Action action;
    private final DenyReason reason;

    public ForbiddenException(Action action, DenyReason reason) {
        super("Action %s denied: %s".formatted(action, reason));
        this.action = action;
        this.reason = reason;
    }

    public Action action() {
        return action;
    }

    public DenyReason reason() {
        return reason;
    }

    @Override
    public Failure failure() {
        return Failure.FORBIDDEN;
    }
}
