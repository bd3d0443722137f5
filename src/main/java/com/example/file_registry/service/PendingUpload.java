package com.example.file_registry.service;

import com.example.file_registry.backend.UploadInstructions;

/** Instructions issued for a direct upload. Nothing is stored until it is confirmed. */
public record PendingUpload(
    String fileId,
    String sourceSlug,
    String path,
    String filename,
    String contentType,
    UploadInstructions instructions) {}
