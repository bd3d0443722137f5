package com.example.file_registry.backend.filesystem;

import com.example.file_registry.backend.BackendFileMetadata;
import com.example.file_registry.backend.BackendSettings;
import com.example.file_registry.backend.FilePage;
import com.example.file_registry.backend.SecretResolver;
import com.example.file_registry.backend.StorageBackend;
import com.example.file_registry.backend.StorageCapabilities;
import com.example.file_registry.exception.BackendUnavailableException;
import com.example.file_registry.exception.ConfigurationException;
import com.example.file_registry.exception.DuplicatePathException;
import com.example.file_registry.exception.InvalidRequestArgumentException;
import com.example.file_registry.exception.ResourceNotFoundException;
import com.example.file_registry.util.ContentHashes;
import com.example.file_registry.util.MimeUtil;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.BasicFileAttributes;
import java.security.DigestInputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Built-in backend keeping files under a root directory. Bytes are always relayed through the host
 * since a local path cannot be handed to a client.
 *
 * <p>Settings: {@code root} (required, created if missing), {@code max_file_size} (optional).
 */
public class FilesystemStorageBackend implements StorageBackend {
  public static final String TYPE = "filesystem";
  private static final Logger log = LoggerFactory.getLogger(FilesystemStorageBackend.class);

  private Path root;
  private StorageCapabilities capabilities;

  @Override
  public String storageType() {
    return TYPE;
  }

  @Override
  public void configure(Map<String, Object> settings, SecretResolver secrets) {
    BackendSettings config = new BackendSettings(TYPE, settings);
    Path configuredRoot = Paths.get(config.requireString("root")).toAbsolutePath().normalize();
    try {
      Files.createDirectories(configuredRoot);
    } catch (IOException e) {
      throw new ConfigurationException("Cannot create storage root " + configuredRoot, e);
    }
    if (!Files.isDirectory(configuredRoot) || !Files.isWritable(configuredRoot)) {
      throw new ConfigurationException(
          "Storage root is not a writable directory: " + configuredRoot);
    }
    this.root = configuredRoot;
    this.capabilities =
        StorageCapabilities.builder()
            .canUpload(true)
            .canDelete(true)
            .canList(true)
            .requiresProxyDownload(true)
            .maxFileSize(config.getLong("max_file_size"))
            .build();
    log.info("Filesystem storage configured at {}", root);
  }

  @Override
  public StorageCapabilities describeCapabilities() {
    return capabilities;
  }

  @Override
  public Optional<BackendFileMetadata> statFile(String path) {
    Optional<Path> target = resolve(path);
    if (target.isEmpty() || !Files.isRegularFile(target.get())) {
      return Optional.empty();
    }
    try {
      BasicFileAttributes attributes =
          Files.readAttributes(target.get(), BasicFileAttributes.class);
      return Optional.of(toMetadata(path, target.get(), attributes));
    } catch (NoSuchFileException e) {
      return Optional.empty();
    } catch (IOException e) {
      throw new BackendUnavailableException("Cannot stat " + path, e);
    }
  }

  @Override
  public byte[] readFile(String path) {
    Path target = existing(path);
    try {
      return Files.readAllBytes(target);
    } catch (NoSuchFileException e) {
      throw new ResourceNotFoundException("File not found: " + path, e);
    } catch (IOException e) {
      throw new BackendUnavailableException("Cannot read " + path, e);
    }
  }

  @Override
  public InputStream openStream(String path) {
    Path target = existing(path);
    try {
      return Files.newInputStream(target);
    } catch (NoSuchFileException e) {
      throw new ResourceNotFoundException("File not found: " + path, e);
    } catch (IOException e) {
      throw new BackendUnavailableException("Cannot open " + path, e);
    }
  }

  /** Paths are listed in lexical order; the cursor is the last path of the previous page. */
  @Override
  public FilePage listFiles(String prefix, String cursor, int limit) {
    String normalizedPrefix = prefix == null ? "" : prefix;
    List<String> paths;
    try (Stream<Path> walk = Files.walk(root)) {
      paths =
          walk.filter(Files::isRegularFile)
              .map(this::relativePath)
              .filter(rel -> rel.startsWith(normalizedPrefix))
              .filter(rel -> cursor == null || rel.compareTo(cursor) > 0)
              .sorted()
              .limit(limit + 1L)
              .collect(Collectors.toList());
    } catch (IOException e) {
      throw new BackendUnavailableException("Cannot list " + root, e);
    }
    boolean more = paths.size() > limit;
    List<BackendFileMetadata> files = new ArrayList<>();
    for (String rel : more ? paths.subList(0, limit) : paths) {
      statFile(rel).ifPresent(files::add);
    }
    return new FilePage(files, more ? paths.get(limit - 1) : null);
  }

  @Override
  public BackendFileMetadata storeFile(
      String path, InputStream content, long size, String contentType) {
    Path target =
        resolve(path)
            .orElseThrow(
                () -> new InvalidRequestArgumentException("Path escapes storage root: " + path));
    try {
      Files.createDirectories(target.getParent());
      long written;
      String hash;
      try (DigestInputStream digestIn = new DigestInputStream(content, ContentHashes.newSha256())) {
        written = Files.copy(digestIn, target);
        hash = ContentHashes.tagSha256(digestIn.getMessageDigest().digest());
      }
      log.debug("Stored {} ({} bytes) under {}", path, written, root);
      return BackendFileMetadata.builder()
          .path(path)
          .filename(target.getFileName().toString())
          .contentType(contentType)
          .contentHash(hash)
          .size(written)
          .build();
    } catch (FileAlreadyExistsException e) {
      throw new DuplicatePathException("Path already exists: " + path, e);
    } catch (IOException e) {
      throw new BackendUnavailableException("Cannot write " + path, e);
    }
  }

  @Override
  public void deleteFile(String path) {
    Path target = existing(path);
    try {
      Files.delete(target);
      removeEmptyParents(target.getParent());
    } catch (NoSuchFileException e) {
      throw new ResourceNotFoundException("File not found: " + path, e);
    } catch (IOException e) {
      throw new BackendUnavailableException("Cannot delete " + path, e);
    }
  }

  private void removeEmptyParents(Path directory) throws IOException {
    Path current = directory;
    while (current != null && !current.equals(root) && current.startsWith(root)) {
      try (Stream<Path> children = Files.list(current)) {
        if (children.findAny().isPresent()) {
          return;
        }
      }
      Files.deleteIfExists(current);
      current = current.getParent();
    }
  }

  private Path existing(String path) {
    return resolve(path)
        .filter(Files::isRegularFile)
        .orElseThrow(() -> new ResourceNotFoundException("File not found: " + path));
  }

  /** Empty when the path would leave the root. */
  private Optional<Path> resolve(String path) {
    if (path == null || path.isBlank()) {
      return Optional.empty();
    }
    Path resolved = root.resolve(path).normalize();
    if (!resolved.startsWith(root) || resolved.equals(root)) {
      return Optional.empty();
    }
    return Optional.of(resolved);
  }

  private String relativePath(Path file) {
    return root.relativize(file).toString().replace(file.getFileSystem().getSeparator(), "/");
  }

  private BackendFileMetadata toMetadata(
      String path, Path target, BasicFileAttributes attributes) {
    String filename = target.getFileName().toString();
    return BackendFileMetadata.builder()
        .path(path)
        .filename(filename)
        .contentType(MimeUtil.detect(filename))
        .size(attributes.size())
        .createdAt(attributes.creationTime().toInstant())
        .build();
  }
}
