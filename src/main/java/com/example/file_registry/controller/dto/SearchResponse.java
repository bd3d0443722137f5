package com.example.file_registry.controller.dto;

import java.util.List;
import java.util.Set;

public record SearchResponse(
    List<FileResponse> files, String nextCursor, Set<String> searchedSources) {}
