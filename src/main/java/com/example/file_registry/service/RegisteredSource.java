package com.example.file_registry.service;

import com.example.file_registry.backend.StorageBackend;
import com.example.file_registry.backend.StorageCapabilities;

/** A configured source: its backend instance and the capabilities it declared. */
public record RegisteredSource(
    String slug,
    String backendType,
    String label,
    StorageBackend backend,
    StorageCapabilities capabilities) {}
