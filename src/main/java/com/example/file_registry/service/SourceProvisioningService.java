package com.example.file_registry.service;

import com.example.file_registry.config.FileRegistryProperties;
import com.example.file_registry.exception.ConfigurationException;
import com.example.file_registry.exception.InvalidRequestArgumentException;
import com.example.file_registry.exception.UnknownBackendTypeException;
import com.example.file_registry.model.SourceDefinition;
import com.example.file_registry.repository.SourceDefinitionRepository;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

/**
 * Brings sources into the {@link SourceRegistry}: the ones declared under {@code files.sources}
 * first, then the ones persisted by earlier runtime registrations. Runs once all singletons exist,
 * which is before the web server accepts requests.
 */
@Service
public class SourceProvisioningService implements SmartInitializingSingleton {
  private static final Logger log = LoggerFactory.getLogger(SourceProvisioningService.class);

  private final SourceRegistry sourceRegistry;
  private final SourceDefinitionRepository sourceDefinitionRepository;
  private final FileRegistryProperties properties;

  public SourceProvisioningService(
      SourceRegistry sourceRegistry,
      SourceDefinitionRepository sourceDefinitionRepository,
      FileRegistryProperties properties) {
    this.sourceRegistry = sourceRegistry;
    this.sourceDefinitionRepository = sourceDefinitionRepository;
    this.properties = properties;
  }

  @Override
  public void afterSingletonsInstantiated() {
    bootstrap();
  }

  /**
   * A slug both declared and persisted aborts startup. Any other failure only takes the affected
   * source out and is reported through {@link SourceRegistry#failures()}.
   */
  public void bootstrap() {
    Map<String, FileRegistryProperties.SourceProperties> declared = properties.getSources();
    List<SourceDefinition> persisted = sourceDefinitionRepository.findAll();

    TreeSet<String> collisions =
        persisted.stream()
            .map(SourceDefinition::getSlug)
            .filter(declared::containsKey)
            .collect(Collectors.toCollection(TreeSet::new));
    if (!collisions.isEmpty()) {
      throw new ConfigurationException(
          "Sources declared in configuration are also registered at runtime: " + collisions);
    }

    declared.forEach(
        (slug, source) ->
            tryRegister(slug, source.getStorage(), source.getLabel(), source.getConfig()));
    persisted.forEach(
        definition ->
            tryRegister(
                definition.getSlug(),
                definition.getBackendType(),
                definition.getLabel(),
                definition.getConfig()));

    log.info(
        "Source bootstrap finished: {} available, {} unavailable",
        sourceRegistry.list().size(),
        sourceRegistry.failures().size());
  }

  private void tryRegister(
      String slug, String backendType, String label, Map<String, Object> config) {
    try {
      sourceRegistry.register(slug, backendType, label, config);
    } catch (ConfigurationException
        | UnknownBackendTypeException
        | InvalidRequestArgumentException e) {
      log.warn("Source '{}' is unavailable: {}", slug, e.getMessage());
      sourceRegistry.recordFailure(slug, e.getMessage());
    }
  }

  /**
   * Administrative registration. The source is configured first and persisted only once its
   * backend accepted the settings, so a rejected configuration leaves nothing behind.
   */
  public RegisteredSource registerRuntimeSource(
      String slug, String backendType, String label, Map<String, Object> config) {
    if (properties.getSources().containsKey(slug) || sourceDefinitionRepository.existsById(slug)) {
      throw new ConfigurationException("Source '" + slug + "' already exists");
    }
    Map<String, Object> settings = config == null ? Map.of() : new LinkedHashMap<>(config);
    RegisteredSource source = sourceRegistry.register(slug, backendType, label, settings);
    SourceDefinition definition =
        SourceDefinition.builder()
            .slug(slug)
            .backendType(backendType)
            .label(source.label())
            .config(settings)
            .createdAt(Instant.now())
            .build();
    try {
      sourceDefinitionRepository.insert(definition);
    } catch (DuplicateKeyException e) {
      sourceRegistry.unregister(slug);
      throw new ConfigurationException("Source '" + slug + "' already exists", e);
    } catch (RuntimeException e) {
      sourceRegistry.unregister(slug);
      throw e;
    }
    log.info("Persisted runtime source '{}' ({})", slug, backendType);
    return source;
  }

  /** Records the completion of a sync pass; configuration-declared sources are not persisted. */
  public void markSynced(String slug, Instant syncedAt) {
    sourceDefinitionRepository
        .findById(slug)
        .ifPresent(
            definition -> {
              definition.setLastSyncedAt(syncedAt);
              sourceDefinitionRepository.save(definition);
            });
  }
}
