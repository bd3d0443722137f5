package com.example.file_registry.model;

import java.time.Instant;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/** A source created at runtime; sources from static configuration are never persisted. */
@Document("sources")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SourceDefinition {
  @Id private String slug;

  private String backendType;

  private String label;

  private Map<String, Object> config;

  private Instant createdAt;

  private Instant lastSyncedAt;
}
