package com.example.file_registry.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Settings under the {@code files} prefix. */
@Data
@ConfigurationProperties(prefix = "files")
public class FileRegistryProperties {

  /** Sources declared in configuration, keyed by slug. Registered before persisted ones. */
  private Map<String, SourceProperties> sources = new LinkedHashMap<>();

  private Duration signedUrlTtl = Duration.ofMinutes(5);

  private Duration directUploadTtl = Duration.ofMinutes(15);

  private Backend backend = new Backend();

  private Search search = new Search();

  private Access access = new Access();

  /** Secret values for the default secret resolver. */
  private Map<String, String> secrets = new LinkedHashMap<>();

  /**
   * Names the default secret resolver may also look up in the environment when {@link #secrets}
   * has no entry. Nothing else in the environment is reachable through a secret name.
   */
  private List<String> environmentSecrets = new ArrayList<>();

  @Data
  public static class SourceProperties {
    private String storage;
    private String label;
    private Map<String, Object> config = new LinkedHashMap<>();
  }

  @Data
  public static class Backend {
    private Duration timeout = Duration.ofSeconds(30);
    private int threadsPerSource = 4;
  }

  @Data
  public static class Search {
    private int defaultLimit = 50;
    private int maxLimit = 500;
  }

  @Data
  public static class Access {
    private boolean defaultAllowed = false;

    /** Actor ids allowed per source slug; {@code *} admits every caller. */
    private Map<String, List<String>> sources = new LinkedHashMap<>();

    /**
     * Basic-auth accounts allowed to register sources at runtime, user name to encoded password
     * ({@code {bcrypt}...}, {@code {noop}...}). Without any, runtime registration is closed over
     * HTTP.
     */
    private Map<String, String> admins = new LinkedHashMap<>();
  }
}
