package com.example.file_registry.controller.dto;

import java.util.List;
import java.util.Map;

/** {@code unavailable} maps slugs that failed to start to the reason. */
public record SourcesResponse(List<SourceResponse> sources, Map<String, String> unavailable) {}
