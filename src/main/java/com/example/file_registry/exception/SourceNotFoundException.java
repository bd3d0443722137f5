package com.example.file_registry.exception;

public class SourceNotFoundException extends RuntimeException {
  public SourceNotFoundException(String message) {
    super(message);
  }

  public SourceNotFoundException(String message, Throwable cause) {
    super(message, cause);
  }
}
