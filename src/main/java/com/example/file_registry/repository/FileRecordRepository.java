package com.example.file_registry.repository;

import com.example.file_registry.model.FileRecord;
import java.util.stream.Stream;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface FileRecordRepository extends MongoRepository<FileRecord, String> {
  boolean existsBySourceSlugAndPath(String sourceSlug, String path);

  Stream<FileRecord> streamBySourceSlug(String sourceSlug);
}
