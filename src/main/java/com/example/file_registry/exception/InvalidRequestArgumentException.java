package com.example.file_registry.exception;

public class InvalidRequestArgumentException extends RuntimeException {
  public InvalidRequestArgumentException(String message) {
    super(message);
  }

  public InvalidRequestArgumentException(String message, Throwable cause) {
    super(message, cause);
  }
}
