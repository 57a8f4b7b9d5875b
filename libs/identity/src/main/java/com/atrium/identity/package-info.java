/**
 * Token issuance/verification and password hashing. The only place the signing key and
 * stored password hashes are handled.
 */
package com.atrium.identity;
