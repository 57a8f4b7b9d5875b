package com.atrium.security;

/**
 * Why the evaluator denied a request. Internal only: logged and counted, never returned
 * to the caller.
 */
public enum DenyReason {
    TENANT_MISMATCH,
    MISSING_CAPABILITY,
    NOT_OWNER
}
