package com.example.file_registry.model;

import java.util.List;
import java.util.Set;

/**
 * A page of search hits. {@code searchedSources} is the subset of the allowed sources that had at
 * least one match.
 */
public record FileSearchResult(
    List<FileRecord> records, String nextCursor, Set<String> searchedSources) {}
