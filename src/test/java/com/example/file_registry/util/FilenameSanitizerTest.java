package com.example.file_registry.util;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class FilenameSanitizerTest {

  @Test
  void sanitize_plainName_isUnchanged() {
    assertEquals("report.pdf", FilenameSanitizer.sanitize("report.pdf"));
  }

  @Test
  void sanitize_traversalSegments_areDropped() {
    assertEquals("etc_passwd", FilenameSanitizer.sanitize("../../etc/passwd"));
    assertEquals("a_b.txt", FilenameSanitizer.sanitize("a\\..\\b.txt"));
  }

  @Test
  void sanitize_controlCharacters_areRemoved() {
    assertEquals("evil.txt", FilenameSanitizer.sanitize("ev\u0000il\n.txt"));
  }

  @Test
  void sanitize_windowsForbiddenCharacters_becomeUnderscores() {
    assertEquals("a_b_.txt", FilenameSanitizer.sanitize("a<b>.txt"));
  }

  @Test
  void sanitize_nothingLeft_fallsBackToPlaceholder() {
    assertEquals(FilenameSanitizer.FALLBACK_NAME, FilenameSanitizer.sanitize(null));
    assertEquals(FilenameSanitizer.FALLBACK_NAME, FilenameSanitizer.sanitize("../.."));
    assertEquals(FilenameSanitizer.FALLBACK_NAME, FilenameSanitizer.sanitize("   "));
  }

  @Test
  void sanitize_reservedDeviceName_isPrefixed() {
    assertEquals("_nul.txt", FilenameSanitizer.sanitize("nul.txt"));
  }

  @Test
  void sanitize_longName_isTruncatedKeepingExtension() {
    String sanitized = FilenameSanitizer.sanitize("x".repeat(300) + ".png");
    assertEquals(255, sanitized.codePointCount(0, sanitized.length()));
    assertTrue(sanitized.endsWith(".png"));
  }
}
