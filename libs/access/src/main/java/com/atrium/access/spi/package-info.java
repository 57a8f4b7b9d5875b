/**
 * Storage collaborators consumed by the access layer.
 */
package com.atrium.access.spi;
