package com.example.file_registry.backend;

import lombok.Builder;

/**
 * Fixed set of flags a backend declares once it is configured. The upload and download paths only
 * invoke optional {@link StorageBackend} operations that are declared here.
 *
 * @param requiresDirectUpload bytes must travel from the client straight to the backend, so the
 *     host hands out an upload target instead of accepting the content itself
 * @param maxFileSize optional upper bound in bytes, {@code null} when unbounded
 */
@Builder(toBuilder = true)
public record StorageCapabilities(
    boolean canUpload,
    boolean canDelete,
    boolean canList,
    boolean canGenerateSignedUrls,
    boolean canGenerateThumbnails,
    boolean requiresProxyDownload,
    boolean requiresDirectUpload,
    Long maxFileSize) {

  public boolean exceedsMaxFileSize(long size) {
    return maxFileSize != null && size > maxFileSize;
  }
}
