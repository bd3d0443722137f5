package com.example.file_registry.security;

/**
 * Authorization predicate owned by the host application. It is evaluated on every read and never
 * cached across requests.
 */
@FunctionalInterface
public interface AccessPolicy {
  boolean isAllowed(CallerContext caller, String sourceSlug);
}
