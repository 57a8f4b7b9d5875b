/**
 * Append-only audit trail of security-relevant mutations.
 * <p>
 * Entries are attributed to the acting user and scoped to that user's tenant. The store
 * is an SPI so that the entry is written in the same unit of work as the mutation.
 */
package com.atrium.audit;
