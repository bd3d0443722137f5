package com.example.file_registry.exception;

/** Transient backend failure. Reads and stores may be retried; deletes must not be blindly. */
public class BackendUnavailableException extends RuntimeException {
  public BackendUnavailableException(String message) {
    super(message);
  }

  public BackendUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
