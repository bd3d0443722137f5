package com.example.file_registry.backend.filesystem;

import com.example.file_registry.backend.StorageBackend;
import com.example.file_registry.backend.StorageBackendFactory;
import org.springframework.stereotype.Component;

@Component
public class FilesystemBackendFactory implements StorageBackendFactory {
  @Override
  public String storageType() {
    return FilesystemStorageBackend.TYPE;
  }

  @Override
  public StorageBackend create() {
    return new FilesystemStorageBackend();
  }
}
