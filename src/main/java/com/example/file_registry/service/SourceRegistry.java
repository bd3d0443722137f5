package com.example.file_registry.service;

import com.example.file_registry.backend.IsolatedStorageBackend;
import com.example.file_registry.backend.SecretResolver;
import com.example.file_registry.backend.StorageBackend;
import com.example.file_registry.backend.StorageBackendFactory;
import com.example.file_registry.backend.StorageCapabilities;
import com.example.file_registry.config.FileRegistryProperties;
import com.example.file_registry.exception.ConfigurationException;
import com.example.file_registry.exception.InvalidRequestArgumentException;
import com.example.file_registry.exception.SourceNotFoundException;
import com.example.file_registry.exception.UnknownBackendTypeException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Component;

/**
 * In-memory mapping from source slug to its configured backend. Backends are created from the
 * {@link StorageBackendFactory} beans, configured here, and wrapped so each source runs its I/O on
 * its own threads.
 */
@Component
public class SourceRegistry implements DisposableBean {
  private static final Logger log = LoggerFactory.getLogger(SourceRegistry.class);
  private static final Pattern SLUG_PATTERN = Pattern.compile("^[a-z0-9][a-z0-9_-]{0,62}$");

  private final Map<String, StorageBackendFactory> factories = new LinkedHashMap<>();
  private final Map<String, RegisteredSource> sources = new ConcurrentHashMap<>();
  private final Map<String, String> failures = new ConcurrentHashMap<>();
  private final SecretResolver secretResolver;
  private final FileRegistryProperties.Backend backendSettings;

  public SourceRegistry(
      List<StorageBackendFactory> backendFactories,
      SecretResolver secretResolver,
      FileRegistryProperties properties) {
    for (StorageBackendFactory factory : backendFactories) {
      StorageBackendFactory previous = factories.putIfAbsent(factory.storageType(), factory);
      if (previous != null) {
        throw new ConfigurationException(
            "Storage type '" + factory.storageType() + "' is contributed twice");
      }
    }
    this.secretResolver = secretResolver;
    this.backendSettings = properties.getBackend();
  }

  public static boolean isValidSlug(String slug) {
    return slug != null && SLUG_PATTERN.matcher(slug).matches();
  }

  /**
   * Instantiates and configures a backend of {@code backendType} for {@code slug}.
   *
   * @throws UnknownBackendTypeException no factory contributes the type
   * @throws ConfigurationException the backend rejected its settings, or the slug is taken
   */
  public RegisteredSource register(
      String slug, String backendType, String label, Map<String, Object> settings) {
    if (!isValidSlug(slug)) {
      throw new InvalidRequestArgumentException("Invalid source slug: " + slug);
    }
    if (sources.containsKey(slug)) {
      throw new ConfigurationException("Source '" + slug + "' is already registered");
    }
    StorageBackendFactory factory = factories.get(backendType);
    if (factory == null) {
      throw new UnknownBackendTypeException(
          "Unknown storage type '" + backendType + "' for source '" + slug + "'");
    }

    StorageBackend backend = factory.create();
    try {
      backend.configure(settings == null ? Map.of() : settings, secretResolver);
    } catch (ConfigurationException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new ConfigurationException(
          "Source '" + slug + "' could not be configured: " + e.getMessage(), e);
    }
    StorageCapabilities capabilities = backend.describeCapabilities();
    IsolatedStorageBackend isolated =
        new IsolatedStorageBackend(
            slug, backend, backendSettings.getThreadsPerSource(), backendSettings.getTimeout());
    RegisteredSource source =
        new RegisteredSource(
            slug, backendType, label == null ? slug : label, isolated, capabilities);

    if (sources.putIfAbsent(slug, source) != null) {
      isolated.close();
      throw new ConfigurationException("Source '" + slug + "' is already registered");
    }
    failures.remove(slug);
    log.info("Registered source '{}' ({}) with {}", slug, backendType, capabilities);
    return source;
  }

  /** Removes a source and stops its threads. Used to roll back a failed runtime registration. */
  public void unregister(String slug) {
    RegisteredSource removed = sources.remove(slug);
    if (removed != null && removed.backend() instanceof IsolatedStorageBackend) {
      ((IsolatedStorageBackend) removed.backend()).close();
      log.info("Unregistered source '{}'", slug);
    }
  }

  public RegisteredSource get(String slug) {
    return find(slug).orElseThrow(() -> new SourceNotFoundException("Source not found: " + slug));
  }

  public Optional<RegisteredSource> find(String slug) {
    return slug == null ? Optional.empty() : Optional.ofNullable(sources.get(slug));
  }

  public boolean contains(String slug) {
    return slug != null && sources.containsKey(slug);
  }

  /** All registered sources ordered by slug. */
  public List<RegisteredSource> list() {
    List<RegisteredSource> all = new ArrayList<>(sources.values());
    all.sort(Comparator.comparing(RegisteredSource::slug));
    return all;
  }

  public Set<String> backendTypes() {
    return new TreeSet<>(factories.keySet());
  }

  void recordFailure(String slug, String reason) {
    failures.put(slug, reason);
  }

  /** Sources that failed to register at startup, with the reason. */
  public Map<String, String> failures() {
    return new TreeMap<>(failures);
  }

  @Override
  public void destroy() {
    sources.keySet().forEach(this::unregister);
  }
}
