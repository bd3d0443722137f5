package com.example.file_registry.exception;

public class PayloadTooLargeException extends RuntimeException {
  private final long maxFileSize;

  public PayloadTooLargeException(long size, long maxFileSize) {
    super("File of " + size + " bytes exceeds the maximum of " + maxFileSize + " bytes");
    this.maxFileSize = maxFileSize;
  }

  public long getMaxFileSize() {
    return maxFileSize;
  }
}
