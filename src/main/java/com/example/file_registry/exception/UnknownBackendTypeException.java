package com.example.file_registry.exception;

public class UnknownBackendTypeException extends RuntimeException {
  public UnknownBackendTypeException(String message) {
    super(message);
  }

  public UnknownBackendTypeException(String message, Throwable cause) {
    super(message, cause);
  }
}
