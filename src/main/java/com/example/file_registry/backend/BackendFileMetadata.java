package com.example.file_registry.backend;

import java.time.Instant;
import java.util.Map;
import lombok.Builder;

/** What a backend knows about one stored object. Optional attributes are {@code null}. */
@Builder(toBuilder = true)
public record BackendFileMetadata(
    String path,
    String filename,
    String contentType,
    String contentHash,
    Long size,
    Integer width,
    Integer height,
    Instant createdAt,
    Map<String, Object> metadata) {}
