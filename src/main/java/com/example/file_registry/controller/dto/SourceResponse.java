package com.example.file_registry.controller.dto;

import com.example.file_registry.backend.StorageCapabilities;

public record SourceResponse(
    String slug, String storage, String label, StorageCapabilities capabilities) {}
