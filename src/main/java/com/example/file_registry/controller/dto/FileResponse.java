package com.example.file_registry.controller.dto;

import java.time.Instant;
import java.util.Map;

public record FileResponse(
    String id,
    String source,
    String path,
    String filename,
    String contentType,
    String contentHash,
    long size,
    Integer width,
    Integer height,
    String createdBy,
    Instant createdAt,
    Map<String, Object> metadata,
    String annotation,
    String downloadLink) {}
