/**
 * Request correlation, log redaction and metric conventions shared by every Atrium module.
 */
package com.atrium.observability;
