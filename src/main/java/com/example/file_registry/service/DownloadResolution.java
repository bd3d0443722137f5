package com.example.file_registry.service;

import com.example.file_registry.backend.SignedUrl;
import com.example.file_registry.model.FileRecord;
import java.io.InputStream;
import org.springframework.http.CacheControl;

/**
 * How to hand out a file's bytes: a redirect to {@code redirect}, or the opened {@code content}
 * stream, which the receiver must close.
 */
public record DownloadResolution(
    FileRecord file, SignedUrl redirect, InputStream content, CacheControl cacheControl) {

  public boolean isRedirect() {
    return redirect != null;
  }

  /** Validator for streamed content; the bytes behind an id never change. */
  public String etag() {
    return file.getId();
  }
}
