package com.example.file_registry.controller.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import java.util.Map;

public record RegisterSourceRequest(
    @NotBlank(message = "Slug must not be blank")
        @Pattern(
            regexp = "^[a-z0-9][a-z0-9_-]{0,62}$",
            message = "Slug must be lowercase letters, digits, '-' or '_'")
        String slug,
    @NotBlank(message = "Storage type must not be blank") String storage,
    String label,
    Map<String, Object> config) {}
