package com.example.file_registry.backend;

import java.util.Optional;

/** Host-supplied lookup of secret values by name, only consulted while a backend is configured. */
@FunctionalInterface
public interface SecretResolver {
  Optional<String> getSecret(String name);

  static SecretResolver none() {
    return name -> Optional.empty();
  }
}
