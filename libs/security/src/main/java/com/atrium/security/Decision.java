package com.atrium.security;

/**
 * Outcome of one authorization evaluation.
 *
 * @param allowed whether the action may proceed
 * @param reason  why it was denied; null when allowed
 */
public record Decision(boolean allowed, DenyReason reason) {

    private static final Decision ALLOW = new Decision(true, null);

    public static Decision allow() {
        return ALLOW;
    }

    public static Decision deny(DenyReason reason) {
        if (reason == null) {
            throw new IllegalArgumentException("a denial needs a reason");
        }
        return new Decision(false, reason);
    }

    /** Label for logs and metric tags ("allow" / "deny"). */
    public String label() {
        return allowed ? "allow" : "deny";
    }
}
