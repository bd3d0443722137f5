package com.example.file_registry.exception;

/**
 * Raised when an operation is invoked against a source whose capability set does not declare it.
 * This signals a caller bug and is never retried.
 */
public class CapabilityMismatchException extends RuntimeException {
  public CapabilityMismatchException(String message) {
    super(message);
  }
}
