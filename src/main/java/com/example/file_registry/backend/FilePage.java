package com.example.file_registry.backend;

import java.util.List;

/** One page of a backend listing. {@code nextCursor} is opaque, {@code null} on the last page. */
public record FilePage(List<BackendFileMetadata> files, String nextCursor) {
  public boolean hasMore() {
    return nextCursor != null;
  }
}
