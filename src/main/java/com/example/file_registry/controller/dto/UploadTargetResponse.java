package com.example.file_registry.controller.dto;

import java.time.Instant;
import java.util.Map;

public record UploadTargetResponse(
    String fileId,
    String filename,
    String contentType,
    String uploadUrl,
    String uploadMethod,
    Map<String, String> uploadHeaders,
    Map<String, String> uploadFields,
    Instant expiresAt,
    String confirmLink) {}
