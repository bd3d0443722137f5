package com.example.file_registry.backend.filesystem;

import static org.junit.jupiter.api.Assertions.*;

import com.example.file_registry.backend.BackendFileMetadata;
import com.example.file_registry.backend.FilePage;
import com.example.file_registry.backend.SecretResolver;
import com.example.file_registry.backend.StorageCapabilities;
import com.example.file_registry.exception.CapabilityMismatchException;
import com.example.file_registry.exception.ConfigurationException;
import com.example.file_registry.exception.DuplicatePathException;
import com.example.file_registry.exception.InvalidRequestArgumentException;
import com.example.file_registry.exception.ResourceNotFoundException;
import com.example.file_registry.util.ContentHashes;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FilesystemStorageBackendTest {

  @TempDir Path tempDir;

  private Path root;
  private FilesystemStorageBackend backend;

  @BeforeEach
  void setUp() {
    root = tempDir.resolve("storage");
    backend = new FilesystemStorageBackend();
    backend.configure(Map.of("root", root.toString()), SecretResolver.none());
  }

  private BackendFileMetadata store(String path, String content) {
    byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
    return backend.storeFile(path, new ByteArrayInputStream(bytes), bytes.length, "text/plain");
  }

  @Test
  void configure_createsRootAndDeclaresProxyCapabilities() {
    assertTrue(Files.isDirectory(root));
    StorageCapabilities capabilities = backend.describeCapabilities();
    assertTrue(capabilities.canUpload());
    assertTrue(capabilities.canDelete());
    assertTrue(capabilities.canList());
    assertTrue(capabilities.requiresProxyDownload());
    assertFalse(capabilities.canGenerateSignedUrls());
    assertNull(capabilities.maxFileSize());
  }

  @Test
  void configure_missingRoot_throwsConfigurationException() {
    FilesystemStorageBackend unconfigured = new FilesystemStorageBackend();
    assertThrows(
        ConfigurationException.class,
        () -> unconfigured.configure(Map.of(), SecretResolver.none()));
  }

  @Test
  void configure_rootIsAFile_throwsConfigurationException() throws IOException {
    Path file = Files.writeString(tempDir.resolve("not-a-dir"), "x");
    FilesystemStorageBackend unconfigured = new FilesystemStorageBackend();
    assertThrows(
        ConfigurationException.class,
        () -> unconfigured.configure(Map.of("root", file.toString()), SecretResolver.none()));
  }

  @Test
  void configure_maxFileSize_isDeclared() {
    FilesystemStorageBackend limited = new FilesystemStorageBackend();
    limited.configure(
        Map.of("root", root.toString(), "max_file_size", "1024"), SecretResolver.none());
    assertEquals(1024L, limited.describeCapabilities().maxFileSize());
  }

  @Test
  void storeFile_returnsSizeAndSha256OfContent() {
    String content = "Hello, attachments registry!";
    BackendFileMetadata stored = store("01abc/hello.txt", content);

    assertEquals(content.length(), stored.size());
    assertEquals(
        ContentHashes.sha256(content.getBytes(StandardCharsets.UTF_8)), stored.contentHash());
    assertEquals("hello.txt", stored.filename());
    assertArrayEquals(
        content.getBytes(StandardCharsets.UTF_8), backend.readFile("01abc/hello.txt"));
  }

  @Test
  void storeFile_occupiedPath_throwsDuplicatePathAndKeepsOriginal() {
    store("01abc/a.txt", "first");
    assertThrows(DuplicatePathException.class, () -> store("01abc/a.txt", "second"));
    assertEquals("first", new String(backend.readFile("01abc/a.txt"), StandardCharsets.UTF_8));
  }

  @Test
  void storeFile_pathEscapingRoot_isRejected() {
    assertThrows(InvalidRequestArgumentException.class, () -> store("../outside.txt", "x"));
    assertFalse(Files.exists(tempDir.resolve("outside.txt")));
  }

  @Test
  void statFile_absentOrEscapingPath_returnsEmpty() {
    assertTrue(backend.statFile("missing.txt").isEmpty());
    assertTrue(backend.statFile("../storage").isEmpty());
  }

  @Test
  void statFile_existingPath_reportsSizeAndGuessedType() {
    store("01abc/data.json", "{}");
    BackendFileMetadata stat = backend.statFile("01abc/data.json").orElseThrow();
    assertEquals(2L, stat.size());
    assertEquals("application/json", stat.contentType());
  }

  @Test
  void readFile_absentPath_throwsNotFound() {
    assertThrows(ResourceNotFoundException.class, () -> backend.readFile("nope.txt"));
  }

  @Test
  void openStream_streamsContent() throws IOException {
    store("01abc/s.txt", "streamed");
    try (InputStream in = backend.openStream("01abc/s.txt")) {
      assertEquals("streamed", new String(in.readAllBytes(), StandardCharsets.UTF_8));
    }
  }

  @Test
  void deleteFile_removesBytesAndEmptyDirectory() {
    store("01abc/gone.txt", "bye");
    backend.deleteFile("01abc/gone.txt");

    assertTrue(backend.statFile("01abc/gone.txt").isEmpty());
    assertFalse(Files.exists(root.resolve("01abc")));
    assertTrue(Files.isDirectory(root));
  }

  @Test
  void deleteFile_absentPath_throwsNotFound() {
    assertThrows(ResourceNotFoundException.class, () -> backend.deleteFile("01abc/none.txt"));
  }

  @Test
  void listFiles_pagesInPathOrderWithCursor() {
    store("b/2.txt", "2");
    store("a/1.txt", "1");
    store("c/3.txt", "3");

    List<String> seen = new ArrayList<>();
    String cursor = null;
    int pages = 0;
    do {
      FilePage page = backend.listFiles("", cursor, 2);
      page.files().forEach(file -> seen.add(file.path()));
      cursor = page.nextCursor();
      pages++;
    } while (cursor != null);

    assertEquals(List.of("a/1.txt", "b/2.txt", "c/3.txt"), seen);
    assertEquals(2, pages);
  }

  @Test
  void listFiles_prefix_narrowsResults() {
    store("a/1.txt", "1");
    store("b/2.txt", "2");
    FilePage page = backend.listFiles("b/", null, 10);
    assertEquals(1, page.files().size());
    assertEquals("b/2.txt", page.files().get(0).path());
    assertFalse(page.hasMore());
  }

  @Test
  void signedDownloadUrl_isNotSupported() {
    assertThrows(
        CapabilityMismatchException.class,
        () -> backend.signedDownloadUrl("a.txt", Duration.ofMinutes(5)));
  }
}
