package com.example.file_registry.backend;

import com.example.file_registry.exception.CapabilityMismatchException;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Capability contract every storage provider implements.
 *
 * <p>{@link #configure}, {@link #describeCapabilities}, {@link #statFile} and {@link #readFile} are
 * required. The remaining operations are optional and may only be invoked when the matching flag is
 * set in {@link #describeCapabilities()}; the defaults raise {@link CapabilityMismatchException}.
 *
 * <p>Failure conventions: a missing path raises {@code ResourceNotFoundException}, transient I/O
 * problems raise {@code BackendUnavailableException}, bad settings raise {@code
 * ConfigurationException}.
 */
public interface StorageBackend {

  String storageType();

  /**
   * One-time initialization with the backend-specific settings of a source. Each implementation
   * validates its own keys.
   */
  void configure(Map<String, Object> settings, SecretResolver secrets);

  /** Must not change once {@link #configure} has returned. */
  StorageCapabilities describeCapabilities();

  /** Metadata for an existing path, or empty when the path is absent. */
  Optional<BackendFileMetadata> statFile(String path);

  byte[] readFile(String path);

  default InputStream openStream(String path) {
    return new ByteArrayInputStream(readFile(path));
  }

  default FilePage listFiles(String prefix, String cursor, int limit) {
    throw unsupported("listing");
  }

  /**
   * Persists {@code content} at {@code path}. Never overwrites: an occupied path raises {@code
   * DuplicatePathException}. The returned metadata carries a freshly computed size and content
   * hash.
   */
  default BackendFileMetadata storeFile(
      String path, InputStream content, long size, String contentType) {
    throw unsupported("uploads");
  }

  default void deleteFile(String path) {
    throw unsupported("deletion");
  }

  default SignedUrl signedDownloadUrl(String path, Duration ttl) {
    throw unsupported("signed download URLs");
  }

  /**
   * Describes where a client sends the bytes for {@code path}. A non-null {@code contentHash}
   * ({@code sha256:<hex>}) is bound into the target where the backend can verify it, and is then
   * reported by {@link #statFile} once the object exists.
   */
  default UploadInstructions prepareDirectUpload(
      String path, String contentType, long size, String contentHash, Duration ttl) {
    throw unsupported("direct uploads");
  }

  private CapabilityMismatchException unsupported(String operation) {
    return new CapabilityMismatchException(
        "Storage type '" + storageType() + "' does not support " + operation);
  }
}
