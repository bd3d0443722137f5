package com.example.file_registry.backend;

import com.example.file_registry.exception.ConfigurationException;
import java.util.Map;

/** Typed reads over the opaque settings map a source passes to its backend. */
public final class BackendSettings {
  private final String storageType;
  private final Map<String, Object> values;

  public BackendSettings(String storageType, Map<String, Object> values) {
    this.storageType = storageType;
    this.values = values == null ? Map.of() : values;
  }

  public String requireString(String key) {
    String value = getString(key, null);
    if (value == null || value.isBlank()) {
      throw new ConfigurationException(
          "Setting '" + key + "' is required for storage type '" + storageType + "'");
    }
    return value;
  }

  public String getString(String key, String defaultValue) {
    Object value = values.get(key);
    return value == null ? defaultValue : value.toString();
  }

  public Long getLong(String key) {
    Object value = values.get(key);
    if (value == null || value.toString().isBlank()) {
      return null;
    }
    if (value instanceof Number) {
      return ((Number) value).longValue();
    }
    try {
      return Long.parseLong(value.toString().trim());
    } catch (NumberFormatException e) {
      throw new ConfigurationException(
          "Setting '" + key + "' must be a whole number, got '" + value + "'", e);
    }
  }

  public boolean getBoolean(String key, boolean defaultValue) {
    Object value = values.get(key);
    if (value == null) {
      return defaultValue;
    }
    if (value instanceof Boolean) {
      return (Boolean) value;
    }
    return switch (value.toString().trim().toLowerCase()) {
      case "true", "yes", "1" -> true;
      case "false", "no", "0" -> false;
      default -> throw new ConfigurationException(
          "Setting '" + key + "' must be true or false, got '" + value + "'");
    };
  }
}
