package com.example.file_registry.exception;

public class DuplicatePathException extends RuntimeException {
  public DuplicatePathException(String message) {
    super(message);
  }

  public DuplicatePathException(String message, Throwable cause) {
    super(message, cause);
  }
}
