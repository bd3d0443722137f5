package com.example.file_registry.controller.dto;

import jakarta.validation.constraints.Size;

public record AnnotationUpdateRequest(
    @Size(max = 10000, message = "Annotation must be at most 10000 characters")
        String annotation) {}
