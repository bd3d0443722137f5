package com.example.file_registry.service;

import com.example.file_registry.model.FileRecord;

/**
 * Result of {@link UploadOrchestrator#beginUpload}: either the record was created, or the client
 * still has to transfer the bytes and confirm.
 */
public record UploadOutcome(UploadState state, FileRecord file, PendingUpload pending) {

  public enum UploadState {
    PENDING,
    CONFIRMED
  }

  public static UploadOutcome confirmed(FileRecord file) {
    return new UploadOutcome(UploadState.CONFIRMED, file, null);
  }

  public static UploadOutcome pending(PendingUpload pending) {
    return new UploadOutcome(UploadState.PENDING, null, pending);
  }

  public boolean isPending() {
    return state == UploadState.PENDING;
  }
}
