package com.example.file_registry.service;

import com.example.file_registry.backend.BackendFileMetadata;
import com.example.file_registry.backend.StorageBackend;
import com.example.file_registry.backend.StorageCapabilities;
import com.example.file_registry.backend.UploadInstructions;
import com.example.file_registry.config.FileRegistryProperties;
import com.example.file_registry.exception.CapabilityMismatchException;
import com.example.file_registry.exception.InvalidRequestArgumentException;
import com.example.file_registry.exception.PayloadTooLargeException;
import com.example.file_registry.exception.ResourceNotFoundException;
import com.example.file_registry.exception.StorageException;
import com.example.file_registry.model.FileRecord;
import com.example.file_registry.util.ContentHashes;
import com.example.file_registry.util.FileIds;
import com.example.file_registry.util.FilenameSanitizer;
import com.example.file_registry.util.ImageDimensions;
import com.example.file_registry.util.MimeUtil;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.InputStreamSource;
import org.springframework.stereotype.Service;

/**
 * Turns an upload into a registry record. Sources that take bytes through the host get them
 * stored and recorded in one call; sources that need a direct client-to-backend transfer get
 * upload instructions and a later {@link #confirmUpload}.
 *
 * <p>Stored paths are {@code <ulid>/<sanitized filename>}, so equal filenames never collide.
 */
@Service
public class UploadOrchestrator {
  private static final Logger log = LoggerFactory.getLogger(UploadOrchestrator.class);

  private final SourceRegistry sourceRegistry;
  private final FileRegistry fileRegistry;
  private final FileRegistryProperties properties;

  public UploadOrchestrator(
      SourceRegistry sourceRegistry, FileRegistry fileRegistry, FileRegistryProperties properties) {
    this.sourceRegistry = sourceRegistry;
    this.fileRegistry = fileRegistry;
    this.properties = properties;
  }

  public static String storagePath(String fileId, String sanitizedFilename) {
    return FileIds.ulidPart(fileId) + "/" + sanitizedFilename;
  }

  public UploadOutcome beginUpload(UploadRequest request) {
    RegisteredSource source = sourceRegistry.get(request.sourceSlug());
    StorageCapabilities capabilities = source.capabilities();
    if (!capabilities.canUpload()) {
      throw new CapabilityMismatchException(
          "Source '" + source.slug() + "' does not accept uploads");
    }
    if (request.size() < 0) {
      throw new InvalidRequestArgumentException("File size must not be negative");
    }
    if (capabilities.exceedsMaxFileSize(request.size())) {
      throw new PayloadTooLargeException(request.size(), capabilities.maxFileSize());
    }
    if (request.contentHash() != null && !ContentHashes.isSha256(request.contentHash())) {
      throw new InvalidRequestArgumentException(
          "Content hash must look like sha256:<64 lowercase hex digits>");
    }

    String fileId = FileIds.newId();
    String filename = FilenameSanitizer.sanitize(request.filename());
    String path = storagePath(fileId, filename);
    String contentType = MimeUtil.effectiveContentType(request.contentType(), filename);

    if (capabilities.requiresDirectUpload()) {
      UploadInstructions instructions =
          source
              .backend()
              .prepareDirectUpload(
                  path,
                  contentType,
                  request.size(),
                  request.contentHash(),
                  properties.getDirectUploadTtl());
      log.info("Issued direct upload target for {} in source '{}'", path, source.slug());
      return UploadOutcome.pending(
          new PendingUpload(fileId, source.slug(), path, filename, contentType, instructions));
    }
    if (request.content() == null) {
      throw new InvalidRequestArgumentException(
          "Source '" + source.slug() + "' takes the file content with the upload");
    }

    BackendFileMetadata stored = store(source, path, request, contentType);
    long size = stored.size() == null ? request.size() : stored.size();
    if (capabilities.exceedsMaxFileSize(size)) {
      discard(source, path);
      throw new PayloadTooLargeException(size, capabilities.maxFileSize());
    }
    String storedType = stored.contentType() == null ? contentType : stored.contentType();
    Optional<ImageDimensions.Size> dimensions = dimensionsOf(storedType, request.content());

    FileRecord record =
        FileRecord.builder()
            .id(fileId)
            .sourceSlug(source.slug())
            .path(path)
            .filename(filename)
            .contentType(storedType)
            .contentHash(stored.contentHash())
            .size(size)
            .width(dimensions.map(ImageDimensions.Size::width).orElse(stored.width()))
            .height(dimensions.map(ImageDimensions.Size::height).orElse(stored.height()))
            .createdBy(request.createdBy())
            .metadata(request.metadata() == null ? Map.of() : request.metadata())
            .build();
    FileRecord inserted = insertOrDiscard(source, record);
    log.info(
        "Uploaded {} ({} bytes, {}) to source '{}' as {}",
        filename,
        size,
        inserted.getContentHash(),
        source.slug(),
        inserted.getId());
    return UploadOutcome.confirmed(inserted);
  }

  /**
   * Records a finished direct upload. The backend is asked for the object's final size and hash;
   * an object that never arrived is reported as not found.
   */
  public FileRecord confirmUpload(UploadConfirmation confirmation) {
    RegisteredSource source = sourceRegistry.get(confirmation.sourceSlug());
    StorageCapabilities capabilities = source.capabilities();
    if (!capabilities.requiresDirectUpload()) {
      throw new CapabilityMismatchException(
          "Source '" + source.slug() + "' does not take direct uploads");
    }
    if (!FileIds.isValid(confirmation.fileId())) {
      throw new InvalidRequestArgumentException("Invalid file id: " + confirmation.fileId());
    }
    String filename = FilenameSanitizer.sanitize(confirmation.filename());
    String path = storagePath(confirmation.fileId(), filename);

    BackendFileMetadata stat =
        source
            .backend()
            .statFile(path)
            .orElseThrow(
                () -> new ResourceNotFoundException("Uploaded file not found: " + path));
    long size = stat.size() == null ? 0L : stat.size();
    if (capabilities.exceedsMaxFileSize(size)) {
      discard(source, path);
      throw new PayloadTooLargeException(size, capabilities.maxFileSize());
    }

    FileRecord record =
        FileRecord.builder()
            .id(confirmation.fileId())
            .sourceSlug(source.slug())
            .path(path)
            .filename(filename)
            .contentType(MimeUtil.effectiveContentType(stat.contentType(), filename))
            .contentHash(stat.contentHash())
            .size(size)
            .width(stat.width())
            .height(stat.height())
            .createdBy(confirmation.createdBy())
            .metadata(confirmation.metadata() == null ? Map.of() : confirmation.metadata())
            .build();
    // a failed insert keeps the object: the client may retry the confirmation
    FileRecord inserted = fileRegistry.insert(record);
    log.info("Confirmed direct upload {} in source '{}'", inserted.getId(), source.slug());
    return inserted;
  }

  private BackendFileMetadata store(
      RegisteredSource source, String path, UploadRequest request, String contentType) {
    try (InputStream in = request.content().getInputStream()) {
      return source.backend().storeFile(path, in, request.size(), contentType);
    } catch (IOException e) {
      throw new StorageException("Cannot read upload content for " + path, e);
    }
  }

  private FileRecord insertOrDiscard(RegisteredSource source, FileRecord record) {
    try {
      return fileRegistry.insert(record);
    } catch (RuntimeException e) {
      discard(source, record.getPath());
      throw e;
    }
  }

  /** Best effort removal of bytes that will not get a record. */
  private void discard(RegisteredSource source, String path) {
    if (!source.capabilities().canDelete()) {
      log.warn("Source '{}' cannot delete, {} is left orphaned", source.slug(), path);
      return;
    }
    StorageBackend backend = source.backend();
    try {
      backend.deleteFile(path);
    } catch (RuntimeException e) {
      log.warn("Could not remove orphaned {} from source '{}'", path, source.slug(), e);
    }
  }

  private static Optional<ImageDimensions.Size> dimensionsOf(
      String contentType, InputStreamSource content) {
    if (!MimeUtil.isImage(contentType)) {
      return Optional.empty();
    }
    try (InputStream in = content.getInputStream()) {
      return ImageDimensions.read(in);
    } catch (IOException e) {
      log.debug("Image dimensions unavailable: {}", e.getMessage());
      return Optional.empty();
    }
  }
}
