package com.example.file_registry.controller.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.Map;

public record PrepareUploadRequest(
    @NotBlank(message = "Filename must not be blank") String filename,
    String contentType,
    @PositiveOrZero(message = "Size must not be negative") long size,
    Map<String, Object> metadata,
    @Pattern(
            regexp = "^sha256:[0-9a-f]{64}$",
            message = "Content hash must look like sha256:<64 lowercase hex digits>")
        String contentHash) {}
