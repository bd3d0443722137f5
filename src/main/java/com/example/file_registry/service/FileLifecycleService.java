package com.example.file_registry.service;

import com.example.file_registry.exception.BackendUnavailableException;
import com.example.file_registry.exception.CapabilityMismatchException;
import com.example.file_registry.exception.InvalidRequestArgumentException;
import com.example.file_registry.exception.ResourceNotFoundException;
import com.example.file_registry.model.FileRecord;
import com.example.file_registry.security.CallerContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Deletion and annotation edits, the only changes a registered file can see. */
@Service
public class FileLifecycleService {
  private static final Logger log = LoggerFactory.getLogger(FileLifecycleService.class);
  static final int MAX_ANNOTATION_LENGTH = 10_000;

  private final ScopedFileQueryService scopedFileQueryService;
  private final SourceRegistry sourceRegistry;
  private final FileRegistry fileRegistry;

  public FileLifecycleService(
      ScopedFileQueryService scopedFileQueryService,
      SourceRegistry sourceRegistry,
      FileRegistry fileRegistry) {
    this.scopedFileQueryService = scopedFileQueryService;
    this.sourceRegistry = sourceRegistry;
    this.fileRegistry = fileRegistry;
  }

  /**
   * Removes the bytes first and the row second. If the backend step fails the row stays, so a
   * failure can orphan bytes but never leave a readable record without them. When the backend
   * reports itself unavailable the path is checked again and the row goes if the bytes did.
   */
  public void delete(CallerContext caller, String fileId) {
    FileRecord record = scopedFileQueryService.get(caller, fileId);
    RegisteredSource source = sourceRegistry.get(record.getSourceSlug());
    if (!source.capabilities().canDelete()) {
      throw new CapabilityMismatchException(
          "Source '" + source.slug() + "' does not support deletion");
    }
    try {
      source.backend().deleteFile(record.getPath());
    } catch (ResourceNotFoundException e) {
      log.warn(
          "Bytes of {} were already gone from source '{}' at {}",
          fileId,
          source.slug(),
          record.getPath());
    } catch (BackendUnavailableException e) {
      if (source.backend().statFile(record.getPath()).isPresent()) {
        throw e;
      }
      log.warn(
          "Delete of {} in source '{}' reported a failure but the bytes are gone",
          fileId,
          source.slug(),
          e);
    }
    fileRegistry.delete(fileId);
    log.info("Deleted {} from source '{}'", fileId, source.slug());
  }

  public FileRecord annotate(CallerContext caller, String fileId, String annotation) {
    scopedFileQueryService.get(caller, fileId);
    String normalized = annotation == null || annotation.isBlank() ? null : annotation.strip();
    if (normalized != null && normalized.length() > MAX_ANNOTATION_LENGTH) {
      throw new InvalidRequestArgumentException(
          "Annotation exceeds " + MAX_ANNOTATION_LENGTH + " characters");
    }
    return fileRegistry.updateAnnotation(fileId, normalized);
  }
}
