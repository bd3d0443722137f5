package com.example.file_registry.controller.dto;

import com.example.file_registry.util.ValidFilename;
import jakarta.validation.constraints.NotBlank;
import java.util.Map;

/** {@code filename} is the sanitized name returned with the upload instructions. */
public record ConfirmUploadRequest(
    @ValidFilename @NotBlank(message = "Filename must not be blank") String filename,
    Map<String, Object> metadata) {}
