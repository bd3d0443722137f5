package com.example.file_registry.service;

import com.example.file_registry.backend.SignedUrl;
import com.example.file_registry.config.FileRegistryProperties;
import com.example.file_registry.exception.ResourceNotFoundException;
import com.example.file_registry.model.FileRecord;
import java.io.InputStream;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.CacheControl;
import org.springframework.stereotype.Service;

@Service
public class DownloadResolver {
  private static final Logger log = LoggerFactory.getLogger(DownloadResolver.class);
  static final Duration IMMUTABLE_MAX_AGE = Duration.ofDays(365);

  private final SourceRegistry sourceRegistry;
  private final FileRegistryProperties properties;

  public DownloadResolver(SourceRegistry sourceRegistry, FileRegistryProperties properties) {
    this.sourceRegistry = sourceRegistry;
    this.properties = properties;
  }

  /**
   * Signed-URL sources get a fresh short-lived redirect that must not be cached; everything else
   * is streamed through the host with long-lived private caching.
   *
   * @throws ResourceNotFoundException the backend no longer has the bytes the record points at
   */
  public DownloadResolution resolve(FileRecord record) {
    RegisteredSource source = sourceRegistry.get(record.getSourceSlug());
    if (source.capabilities().canGenerateSignedUrls()
        && !source.capabilities().requiresProxyDownload()) {
      if (source.backend().statFile(record.getPath()).isEmpty()) {
        throw drift(record, null);
      }
      SignedUrl url =
          source.backend().signedDownloadUrl(record.getPath(), properties.getSignedUrlTtl());
      return new DownloadResolution(record, url, null, CacheControl.noCache());
    }

    InputStream content;
    try {
      content = source.backend().openStream(record.getPath());
    } catch (ResourceNotFoundException e) {
      throw drift(record, e);
    }
    return new DownloadResolution(
        record, null, content, CacheControl.maxAge(IMMUTABLE_MAX_AGE).cachePrivate());
  }

  private static ResourceNotFoundException drift(FileRecord record, Throwable cause) {
    log.warn(
        "Registry has {} but source '{}' has no bytes at {}",
        record.getId(),
        record.getSourceSlug(),
        record.getPath());
    return new ResourceNotFoundException("File content not found: " + record.getId(), cause);
  }
}
