package com.example.file_registry.util;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.apache.commons.io.FilenameUtils;

/**
 * Turns a client-supplied filename into a single safe path segment. Directory parts and
 * traversal segments are dropped. Control characters are removed and characters Windows forbids
 * become underscores. Uniqueness is not this class's concern: stored paths are prefixed with the
 * file id.
 */
public final class FilenameSanitizer {
  static final String FALLBACK_NAME = "unnamed";
  private static final Pattern CONTROL_CHARS = Pattern.compile("\\p{Cntrl}");
  private static final Pattern WINDOWS_FORBIDDEN_CHARS = Pattern.compile("[<>:\"|?*]");
  private static final Pattern SEPARATORS = Pattern.compile("[/\\\\]+");
  private static final Set<String> WINDOWS_RESERVED_NAMES =
      new HashSet<>(
          Arrays.asList(
              "CON", "PRN", "AUX", "NUL", "COM1", "COM2", "COM3", "COM4", "COM5", "COM6", "COM7",
              "COM8", "COM9", "LPT1", "LPT2", "LPT3", "LPT4", "LPT5", "LPT6", "LPT7", "LPT8",
              "LPT9"));
  private static final int MAX_FILENAME_CODE_POINTS = 255;

  private FilenameSanitizer() {}

  public static String sanitize(String filename) {
    if (filename == null) {
      return FALLBACK_NAME;
    }
    String cleaned = CONTROL_CHARS.matcher(filename).replaceAll("");
    cleaned = WINDOWS_FORBIDDEN_CHARS.matcher(cleaned).replaceAll("_");
    String joined =
        Arrays.stream(SEPARATORS.split(cleaned))
            .map(String::trim)
            .filter(segment -> !segment.isEmpty())
            .filter(segment -> !segment.equals(".") && !segment.equals(".."))
            .collect(Collectors.joining("_"));
    if (joined.isEmpty()) {
      return FALLBACK_NAME;
    }
    if (WINDOWS_RESERVED_NAMES.contains(FilenameUtils.getBaseName(joined).toUpperCase())) {
      joined = "_" + joined;
    }
    return truncate(joined);
  }

  private static String truncate(String name) {
    if (name.codePointCount(0, name.length()) <= MAX_FILENAME_CODE_POINTS) {
      return name;
    }
    String extension = FilenameUtils.getExtension(name);
    int keep = MAX_FILENAME_CODE_POINTS - (extension.isEmpty() ? 0 : extension.length() + 1);
    if (keep <= 0) {
      return name.substring(0, name.offsetByCodePoints(0, MAX_FILENAME_CODE_POINTS));
    }
    String base = name.substring(0, name.offsetByCodePoints(0, keep));
    return extension.isEmpty() ? base : base + "." + extension;
  }
}
