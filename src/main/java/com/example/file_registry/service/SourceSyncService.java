package com.example.file_registry.service;

import com.example.file_registry.backend.BackendFileMetadata;
import com.example.file_registry.backend.FilePage;
import com.example.file_registry.exception.CapabilityMismatchException;
import com.example.file_registry.exception.DuplicatePathException;
import com.example.file_registry.model.FileRecord;
import com.example.file_registry.util.FileIds;
import com.example.file_registry.util.MimeUtil;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Brings the registry and a source's backend back in line: {@link #sync} records objects that
 * were put into the backend from outside, {@link #reconcile} drops rows whose bytes are gone. Both
 * passes can be repeated safely.
 */
@Service
public class SourceSyncService {
  private static final Logger log = LoggerFactory.getLogger(SourceSyncService.class);
  static final int PAGE_SIZE = 100;

  private final SourceRegistry sourceRegistry;
  private final FileRegistry fileRegistry;
  private final SourceProvisioningService sourceProvisioningService;

  public SourceSyncService(
      SourceRegistry sourceRegistry,
      FileRegistry fileRegistry,
      SourceProvisioningService sourceProvisioningService) {
    this.sourceRegistry = sourceRegistry;
    this.fileRegistry = fileRegistry;
    this.sourceProvisioningService = sourceProvisioningService;
  }

  public record SyncReport(String sourceSlug, int scanned, int added, int skipped) {}

  public record ReconcileReport(String sourceSlug, int checked, int removed) {}

  /** Records every backend object not yet registered. Synced records have no creator. */
  public SyncReport sync(String sourceSlug) {
    RegisteredSource source = sourceRegistry.get(sourceSlug);
    if (!source.capabilities().canList()) {
      throw new CapabilityMismatchException(
          "Source '" + source.slug() + "' cannot enumerate its contents");
    }
    int scanned = 0;
    int added = 0;
    int skipped = 0;
    String cursor = null;
    do {
      FilePage page = source.backend().listFiles("", cursor, PAGE_SIZE);
      for (BackendFileMetadata object : page.files()) {
        scanned++;
        if (fileRegistry.existsBySourceAndPath(source.slug(), object.path())) {
          skipped++;
          continue;
        }
        try {
          fileRegistry.insert(toRecord(source.slug(), object));
          added++;
        } catch (DuplicatePathException e) {
          // registered concurrently by an upload
          skipped++;
        }
      }
      cursor = page.nextCursor();
    } while (cursor != null);

    sourceProvisioningService.markSynced(source.slug(), Instant.now());
    log.info(
        "Synced source '{}': {} scanned, {} added, {} already registered",
        source.slug(),
        scanned,
        added,
        skipped);
    return new SyncReport(source.slug(), scanned, added, skipped);
  }

  /** Removes rows whose backend object no longer exists. */
  public ReconcileReport reconcile(String sourceSlug) {
    RegisteredSource source = sourceRegistry.get(sourceSlug);
    List<FileRecord> records = fileRegistry.listBySource(source.slug());
    int removed = 0;
    for (FileRecord record : records) {
      if (source.backend().statFile(record.getPath()).isEmpty()) {
        if (fileRegistry.delete(record.getId())) {
          removed++;
          log.warn(
              "Removed {} from the registry: source '{}' has no bytes at {}",
              record.getId(),
              source.slug(),
              record.getPath());
        }
      }
    }
    log.info(
        "Reconciled source '{}': {} checked, {} removed", source.slug(), records.size(), removed);
    return new ReconcileReport(source.slug(), records.size(), removed);
  }

  private static FileRecord toRecord(String sourceSlug, BackendFileMetadata object) {
    String path = object.path();
    String filename =
        object.filename() != null ? object.filename() : path.substring(path.lastIndexOf('/') + 1);
    return FileRecord.builder()
        .id(FileIds.newId())
        .sourceSlug(sourceSlug)
        .path(path)
        .filename(filename)
        .contentType(MimeUtil.effectiveContentType(object.contentType(), filename))
        .contentHash(object.contentHash())
        .size(object.size() == null ? 0L : object.size())
        .width(object.width())
        .height(object.height())
        .metadata(object.metadata() == null ? Map.of() : object.metadata())
        .build();
  }
}
