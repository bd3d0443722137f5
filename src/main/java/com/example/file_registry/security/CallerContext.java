package com.example.file_registry.security;

import java.security.Principal;

/**
 * Who is asking. {@code actorId} is {@code null} for anonymous callers.
 */
public record CallerContext(String actorId) {
  private static final CallerContext ANONYMOUS = new CallerContext(null);

  public static CallerContext anonymous() {
    return ANONYMOUS;
  }

  public static CallerContext of(String actorId) {
    return actorId == null || actorId.isBlank() ? ANONYMOUS : new CallerContext(actorId.trim());
  }

  /** An authenticated principal wins over the {@code X-User-Id} header. */
  public static CallerContext resolve(Principal principal, String userIdHeader) {
    if (principal != null && principal.getName() != null && !principal.getName().isBlank()) {
      return of(principal.getName());
    }
    return of(userIdHeader);
  }

  public boolean isAnonymous() {
    return actorId == null;
  }
}
