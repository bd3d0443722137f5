package com.example.file_registry.backend.s3;

import com.example.file_registry.backend.StorageBackend;
import com.example.file_registry.backend.StorageBackendFactory;
import org.springframework.stereotype.Component;

@Component
public class S3BackendFactory implements StorageBackendFactory {
  @Override
  public String storageType() {
    return S3StorageBackend.TYPE;
  }

  @Override
  public StorageBackend create() {
    return new S3StorageBackend();
  }
}
