package com.example.file_registry.util;

import com.example.file_registry.exception.InvalidRequestArgumentException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * The value a host column stores to attach files: a single file id, or a JSON array of ids when a
 * slot holds several files.
 */
public final class FileReferences {
  private static final ObjectMapper objectMapper = new ObjectMapper();
  private static final TypeReference<List<String>> ID_LIST = new TypeReference<>() {};

  private FileReferences() {}

  public static List<String> parse(String value) {
    if (value == null || value.isBlank()) {
      return List.of();
    }
    String trimmed = value.trim();
    List<String> ids;
    if (trimmed.startsWith("[")) {
      try {
        ids = objectMapper.readValue(trimmed, ID_LIST);
      } catch (JsonProcessingException e) {
        throw new InvalidRequestArgumentException("File reference is not a JSON array of ids", e);
      }
    } else {
      ids = List.of(trimmed);
    }
    LinkedHashSet<String> unique = new LinkedHashSet<>();
    for (String id : ids) {
      if (!FileIds.isValid(id)) {
        throw new InvalidRequestArgumentException("Invalid file id: " + id);
      }
      unique.add(id);
    }
    return new ArrayList<>(unique);
  }

  /** Parses every value and flattens the result, keeping first-seen order. */
  public static List<String> parseAll(List<String> values) {
    LinkedHashSet<String> ids = new LinkedHashSet<>();
    if (values != null) {
      values.forEach(value -> ids.addAll(parse(value)));
    }
    return new ArrayList<>(ids);
  }

  static String format(List<String> ids) {
    if (ids == null || ids.isEmpty()) {
      return null;
    }
    if (ids.size() == 1) {
      return ids.get(0);
    }
    try {
      return objectMapper.writeValueAsString(ids);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Could not serialize file ids", e);
    }
  }
}
