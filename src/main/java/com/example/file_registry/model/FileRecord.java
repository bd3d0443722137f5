package com.example.file_registry.model;

import java.time.Instant;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * One registered file. Everything except {@link #annotation} is fixed at insert time; a changed
 * file is a new record with a new id.
 */
@Document("files")
@CompoundIndexes({
  @CompoundIndex(
      name = "source_path_idx",
      def = "{'sourceSlug': 1, 'path': 1}",
      unique = true)
})
@Value
@AllArgsConstructor
@Builder(toBuilder = true)
public class FileRecord {
  @Id String id;

  @Indexed String sourceSlug;

  String path;

  String filename;

  String contentType;

  String contentHash;

  long size;

  Integer width;

  Integer height;

  @Indexed(sparse = true)
  String createdBy;

  Instant createdAt;

  Map<String, Object> metadata;

  String annotation;
}
