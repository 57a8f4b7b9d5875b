/**
 * Request-level access control: login and refresh, principal resolution, and the
 * pipeline that authorizes, executes and audits each call.
 * <p>
 * Storage is reached only through the interfaces in {@link com.atrium.access.spi}.
 */
package com.atrium.access;
