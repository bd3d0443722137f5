package com.example.file_registry.service;

import static org.junit.jupiter.api.Assertions.*;

import com.example.file_registry.backend.InMemoryBackendFactory;
import com.example.file_registry.backend.InMemoryStorageBackend;
import com.example.file_registry.backend.IsolatedStorageBackend;
import com.example.file_registry.backend.SecretResolver;
import com.example.file_registry.config.FileRegistryProperties;
import com.example.file_registry.exception.CapabilityMismatchException;
import com.example.file_registry.exception.DuplicatePathException;
import com.example.file_registry.exception.InvalidRequestArgumentException;
import com.example.file_registry.exception.PayloadTooLargeException;
import com.example.file_registry.exception.ResourceNotFoundException;
import com.example.file_registry.exception.SourceNotFoundException;
import com.example.file_registry.model.FileRecord;
import com.example.file_registry.util.ContentHashes;
import com.example.file_registry.util.FileIds;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;

class UploadOrchestratorTest {

  private static final byte[] CONTENT =
      "The quick brown fox jumps ok!".getBytes(StandardCharsets.UTF_8);

  private SourceRegistry sourceRegistry;
  private InMemoryFileRegistry fileRegistry;
  private UploadOrchestrator orchestrator;

  @BeforeEach
  void setUp() {
    FileRegistryProperties properties = new FileRegistryProperties();
    sourceRegistry =
        new SourceRegistry(
            List.of(new InMemoryBackendFactory()), SecretResolver.none(), properties);
    sourceRegistry.register("docs", InMemoryStorageBackend.TYPE, "Documents", Map.of());
    sourceRegistry.register(
        "direct",
        InMemoryStorageBackend.TYPE,
        null,
        Map.of("direct_upload", true, "signed_urls", true));
    sourceRegistry.register(
        "small", InMemoryStorageBackend.TYPE, null, Map.of("max_file_size", 10));
    fileRegistry = new InMemoryFileRegistry(sourceRegistry);
    orchestrator = new UploadOrchestrator(sourceRegistry, fileRegistry, properties);
  }

  @AfterEach
  void tearDown() {
    sourceRegistry.destroy();
  }

  private InMemoryStorageBackend backendOf(String slug) {
    return (InMemoryStorageBackend)
        ((IsolatedStorageBackend) sourceRegistry.get(slug).backend()).getDelegate();
  }

  private static UploadRequest upload(String slug, String filename, byte[] bytes) {
    return new UploadRequest(
        slug, filename, "text/plain", bytes.length, new ByteArrayResource(bytes), "alice", null);
  }

  @Test
  void beginUpload_hostIngested_storesBytesAndRecordsFile() {
    UploadOutcome outcome = orchestrator.beginUpload(upload("docs", "report.txt", CONTENT));

    assertFalse(outcome.isPending());
    FileRecord file = outcome.file();
    assertTrue(FileIds.isValid(file.getId()));
    assertEquals("docs", file.getSourceSlug());
    assertEquals(FileIds.ulidPart(file.getId()) + "/report.txt", file.getPath());
    assertEquals("report.txt", file.getFilename());
    assertEquals(29L, file.getSize());
    assertEquals(ContentHashes.sha256(CONTENT), file.getContentHash());
    assertEquals("alice", file.getCreatedBy());
    assertNotNull(file.getCreatedAt());
    assertTrue(backendOf("docs").contains(file.getPath()));
    assertEquals(file, fileRegistry.get(file.getId()));
  }

  @Test
  void beginUpload_sameFilenameTwice_getsDistinctPaths() {
    FileRecord first = orchestrator.beginUpload(upload("docs", "a.txt", CONTENT)).file();
    FileRecord second = orchestrator.beginUpload(upload("docs", "a.txt", CONTENT)).file();

    assertNotEquals(first.getId(), second.getId());
    assertNotEquals(first.getPath(), second.getPath());
  }

  @Test
  void beginUpload_unsafeFilename_isSanitized() {
    FileRecord file =
        orchestrator.beginUpload(upload("docs", "../../etc/passwd", CONTENT)).file();

    assertEquals("etc_passwd", file.getFilename());
    assertFalse(file.getPath().contains(".."));
  }

  @Test
  void beginUpload_declaredSizeOverLimit_isRejectedBeforeStoring() {
    assertThrows(
        PayloadTooLargeException.class,
        () -> orchestrator.beginUpload(upload("small", "big.txt", CONTENT)));
    assertTrue(fileRegistry.listBySource("small").isEmpty());
    assertTrue(backendOf("small").listFiles("", null, 10).files().isEmpty());
  }

  @Test
  void beginUpload_actualSizeOverLimit_discardsStoredBytes() {
    UploadRequest understated =
        new UploadRequest(
            "small", "big.txt", "text/plain", 5, new ByteArrayResource(CONTENT), null, null);

    assertThrows(PayloadTooLargeException.class, () -> orchestrator.beginUpload(understated));
    assertTrue(backendOf("small").listFiles("", null, 10).files().isEmpty());
    assertTrue(fileRegistry.listBySource("small").isEmpty());
  }

  @Test
  void beginUpload_negativeSize_isRejected() {
    UploadRequest request =
        new UploadRequest(
            "docs", "a.txt", "text/plain", -1, new ByteArrayResource(CONTENT), null, null);
    assertThrows(InvalidRequestArgumentException.class, () -> orchestrator.beginUpload(request));
  }

  @Test
  void beginUpload_unknownSource_throwsSourceNotFound() {
    assertThrows(
        SourceNotFoundException.class,
        () -> orchestrator.beginUpload(upload("nope", "a.txt", CONTENT)));
  }

  @Test
  void beginUpload_hostIngestedWithoutContent_isRejected() {
    UploadRequest request = new UploadRequest("docs", "a.txt", "text/plain", 3, null, null, null);
    assertThrows(InvalidRequestArgumentException.class, () -> orchestrator.beginUpload(request));
  }

  @Test
  void beginUpload_registryRejectsRecord_discardsStoredBytes() {
    InMemoryFileRegistry rejecting =
        new InMemoryFileRegistry(sourceRegistry) {
          @Override
          public synchronized FileRecord insert(FileRecord record) {
            throw new DuplicatePathException("Path already registered: " + record.getPath());
          }
        };
    UploadOrchestrator failing =
        new UploadOrchestrator(sourceRegistry, rejecting, new FileRegistryProperties());

    assertThrows(
        DuplicatePathException.class,
        () -> failing.beginUpload(upload("docs", "a.txt", CONTENT)));
    assertTrue(backendOf("docs").listFiles("", null, 10).files().isEmpty());
  }

  @Test
  void beginUpload_directUploadSource_returnsPendingWithoutRecord() {
    UploadRequest request =
        new UploadRequest("direct", "photo.png", "image/png", 1234, null, "bob", null);

    UploadOutcome outcome = orchestrator.beginUpload(request);

    assertTrue(outcome.isPending());
    PendingUpload pending = outcome.pending();
    assertEquals(FileIds.ulidPart(pending.fileId()) + "/photo.png", pending.path());
    assertEquals("PUT", pending.instructions().uploadMethod());
    assertTrue(pending.instructions().uploadUrl().endsWith(pending.path()));
    assertTrue(fileRegistry.find(pending.fileId()).isEmpty());
  }

  @Test
  void beginUpload_directUploadWithDeclaredHash_passesHashToBackend() {
    String hash = ContentHashes.sha256(CONTENT);
    UploadRequest request =
        new UploadRequest("direct", "photo.png", "image/png", 29, null, "bob", null, hash);

    PendingUpload pending = orchestrator.beginUpload(request).pending();

    assertEquals(hash, pending.instructions().uploadHeaders().get("x-content-sha256"));
  }

  @Test
  void beginUpload_malformedDeclaredHash_isRejected() {
    UploadRequest request =
        new UploadRequest("direct", "photo.png", "image/png", 29, null, "bob", null, "md5:abc");

    assertThrows(InvalidRequestArgumentException.class, () -> orchestrator.beginUpload(request));
  }

  @Test
  void confirmUpload_afterClientTransfer_recordsBackendSizeAndHash() {
    PendingUpload pending =
        orchestrator
            .beginUpload(
                new UploadRequest("direct", "photo.png", "image/png", 29, null, "bob", null))
            .pending();
    backendOf("direct").put(pending.path(), CONTENT, "image/png");

    FileRecord file =
        orchestrator.confirmUpload(
            new UploadConfirmation(
                "direct", pending.fileId(), "photo.png", "bob", Map.of("album", "2024")));

    assertEquals(pending.fileId(), file.getId());
    assertEquals(29L, file.getSize());
    assertEquals(ContentHashes.sha256(CONTENT), file.getContentHash());
    assertEquals("2024", file.getMetadata().get("album"));
  }

  @Test
  void confirmUpload_bytesNeverArrived_throwsNotFound() {
    PendingUpload pending =
        orchestrator
            .beginUpload(new UploadRequest("direct", "x.png", "image/png", 3, null, null, null))
            .pending();

    assertThrows(
        ResourceNotFoundException.class,
        () ->
            orchestrator.confirmUpload(
                new UploadConfirmation("direct", pending.fileId(), "x.png", null, null)));
  }

  @Test
  void confirmUpload_hostIngestedSource_isCapabilityMismatch() {
    assertThrows(
        CapabilityMismatchException.class,
        () ->
            orchestrator.confirmUpload(
                new UploadConfirmation("docs", FileIds.newId(), "a.txt", null, null)));
  }

  @Test
  void confirmUpload_invalidFileId_isRejected() {
    assertThrows(
        InvalidRequestArgumentException.class,
        () ->
            orchestrator.confirmUpload(
                new UploadConfirmation("direct", "not-an-id", "a.txt", null, null)));
  }
}
