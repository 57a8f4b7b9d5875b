/**
 * Authorization primitives: roles, the capability table, principals, resource metadata,
 * the evaluator and the caller-visible failure taxonomy. Framework-free.
 */
package com.atrium.security;
