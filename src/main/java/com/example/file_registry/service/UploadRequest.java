package com.example.file_registry.service;

import java.util.Map;
import org.springframework.core.io.InputStreamSource;

/**
 * An upload against one source. {@code content} may be {@code null} when the caller only wants to
 * know where to send the bytes.
 *
 * @param size declared byte length, checked against the source's maximum before anything is stored
 * @param contentHash {@code sha256:<hex>} the client declares for a direct upload, or {@code null}
 */
public record UploadRequest(
    String sourceSlug,
    String filename,
    String contentType,
    long size,
    InputStreamSource content,
    String createdBy,
    Map<String, Object> metadata,
    String contentHash) {

  public UploadRequest(
      String sourceSlug,
      String filename,
      String contentType,
      long size,
      InputStreamSource content,
      String createdBy,
      Map<String, Object> metadata) {
    this(sourceSlug, filename, contentType, size, content, createdBy, metadata, null);
  }
}
