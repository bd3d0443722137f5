package com.example.file_registry.backend.gridfs;

import com.example.file_registry.backend.StorageBackend;
import com.example.file_registry.backend.StorageBackendFactory;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.core.convert.MongoConverter;
import org.springframework.stereotype.Component;

@Component
public class GridFsBackendFactory implements StorageBackendFactory {
  private final MongoDatabaseFactory databaseFactory;
  private final MongoConverter converter;

  public GridFsBackendFactory(MongoDatabaseFactory databaseFactory, MongoConverter converter) {
    this.databaseFactory = databaseFactory;
    this.converter = converter;
  }

  @Override
  public String storageType() {
    return GridFsStorageBackend.TYPE;
  }

  @Override
  public StorageBackend create() {
    return new GridFsStorageBackend(databaseFactory, converter);
  }
}
