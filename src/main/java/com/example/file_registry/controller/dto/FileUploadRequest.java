package com.example.file_registry.controller.dto;

import java.util.Map;

/**
 * Optional {@code properties} part of a multipart upload. {@code filename} overrides the name sent
 * with the file part; it is sanitized either way.
 */
public record FileUploadRequest(String filename, Map<String, Object> metadata) {}
