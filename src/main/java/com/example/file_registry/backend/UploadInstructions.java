package com.example.file_registry.backend;

import java.time.Instant;
import java.util.Map;

/** Where and how a client sends bytes for a direct upload. */
public record UploadInstructions(
    String uploadUrl,
    String uploadMethod,
    Map<String, String> uploadHeaders,
    Map<String, String> uploadFields,
    Instant expiresAt) {}
