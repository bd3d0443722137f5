package com.example.file_registry.security;

import com.example.file_registry.config.FileRegistryProperties;
import java.util.List;

/**
 * Policy read from {@code files.access}: a source listed there admits the actor ids given for it
 * ({@code *} admits everyone, anonymous callers included). Unlisted sources fall back to {@code
 * default-allowed}.
 */
public class ConfiguredAccessPolicy implements AccessPolicy {
  static final String ANY_CALLER = "*";

  private final FileRegistryProperties.Access access;

  public ConfiguredAccessPolicy(FileRegistryProperties.Access access) {
    this.access = access;
  }

  @Override
  public boolean isAllowed(CallerContext caller, String sourceSlug) {
    List<String> actors = access.getSources().get(sourceSlug);
    if (actors == null) {
      return access.isDefaultAllowed();
    }
    if (actors.contains(ANY_CALLER)) {
      return true;
    }
    return !caller.isAnonymous() && actors.contains(caller.actorId());
  }
}
