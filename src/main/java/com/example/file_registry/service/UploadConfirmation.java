package com.example.file_registry.service;

import java.util.Map;

/** Completion notice for a direct upload, echoing the id and filename the caller was given. */
public record UploadConfirmation(
    String sourceSlug,
    String fileId,
    String filename,
    String createdBy,
    Map<String, Object> metadata) {}
