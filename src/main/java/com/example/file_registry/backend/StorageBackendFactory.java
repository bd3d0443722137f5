package com.example.file_registry.backend;

/**
 * Contributes one backend type. The source registry asks the factory for a fresh, unconfigured
 * instance per source so that it controls configuration order itself.
 */
public interface StorageBackendFactory {
  String storageType();

  StorageBackend create();
}
