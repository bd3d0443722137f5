package com.example.file_registry.util;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import org.apache.tika.Tika;

public class MimeUtil {
  public static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";
  private static final Tika tika = new Tika();
  private static final int LOOKAHEAD = 64 * 1024; // 64 KB

  /**
   * Detects the MIME type from the first bytes of {@code raw}. Tika marks and resets the buffered
   * stream, so the returned stream still starts at the first byte and carries the full content.
   */
  public static Detected detect(InputStream raw) throws IOException {
    BufferedInputStream buffered = new BufferedInputStream(raw, LOOKAHEAD);
    String type = tika.detect(buffered);
    return new Detected(buffered, type);
  }

  /** Guess from the filename alone, falling back to {@link #DEFAULT_CONTENT_TYPE}. */
  public static String detect(String filename) {
    if (filename == null || filename.isBlank()) {
      return DEFAULT_CONTENT_TYPE;
    }
    String type = tika.detect(filename);
    return type == null ? DEFAULT_CONTENT_TYPE : type;
  }

  /** The caller's type when it is meaningful, otherwise a guess from the filename. */
  public static String effectiveContentType(String declared, String filename) {
    if (declared != null && !declared.isBlank() && !DEFAULT_CONTENT_TYPE.equals(declared)) {
      return declared;
    }
    return detect(filename);
  }

  public static boolean isImage(String contentType) {
    return contentType != null && contentType.toLowerCase().startsWith("image/");
  }

  public static class Detected {
    public final InputStream stream;
    public final String contentType;

    public Detected(InputStream s, String ct) {
      this.stream = s;
      this.contentType = ct;
    }
  }
}
