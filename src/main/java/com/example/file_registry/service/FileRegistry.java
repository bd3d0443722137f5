package com.example.file_registry.service;

import com.example.file_registry.model.FileRecord;
import com.example.file_registry.model.FileSearchResult;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Durable store of file records, independent of where the bytes live. Reads here are unscoped;
 * request paths go through {@link ScopedFileQueryService}.
 */
public interface FileRegistry {

  /**
   * Stores a new record. A missing id is generated, a missing creation time is set to now.
   *
   * @throws com.example.file_registry.exception.DuplicatePathException the (source, path) pair or
   *     the id is taken
   * @throws com.example.file_registry.exception.SourceNotFoundException the source is not
   *     registered
   */
  FileRecord insert(FileRecord record);

  Optional<FileRecord> find(String id);

  /** @throws com.example.file_registry.exception.ResourceNotFoundException no such id */
  FileRecord get(String id);

  /** Only the ids that exist, in no particular order. */
  List<FileRecord> getMany(Collection<String> ids);

  /**
   * Case-insensitive substring match over filename, content type and annotation, newest first.
   * A blank query matches everything in {@code allowedSources}.
   */
  FileSearchResult search(String query, Set<String> allowedSources, int limit, String cursor);

  boolean existsBySourceAndPath(String sourceSlug, String path);

  /** Every record of a source. */
  List<FileRecord> listBySource(String sourceSlug);

  FileRecord updateAnnotation(String id, String annotation);

  /** Removes the row only; backend bytes are the caller's concern. */
  boolean delete(String id);
}
