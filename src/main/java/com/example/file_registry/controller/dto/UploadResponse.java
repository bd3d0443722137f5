package com.example.file_registry.controller.dto;

/** Exactly one of {@code file} (state CONFIRMED) or {@code upload} (state PENDING) is set. */
public record UploadResponse(String state, FileResponse file, UploadTargetResponse upload) {}
