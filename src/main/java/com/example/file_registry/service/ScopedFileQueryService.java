package com.example.file_registry.service;

import com.example.file_registry.config.FileRegistryProperties;
import com.example.file_registry.exception.ResourceNotFoundException;
import com.example.file_registry.exception.SourceNotFoundException;
import com.example.file_registry.model.FileRecord;
import com.example.file_registry.model.FileSearchResult;
import com.example.file_registry.security.AccessPolicy;
import com.example.file_registry.security.CallerContext;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.stereotype.Service;

/**
 * Every read on behalf of a caller goes through here. A record is visible only while the {@link
 * AccessPolicy} allows its source; the policy is asked again on each call.
 *
 * <p>A file in a source the caller may not see is reported exactly like a missing one.
 */
@Service
public class ScopedFileQueryService {
  private final SourceRegistry sourceRegistry;
  private final FileRegistry fileRegistry;
  private final AccessPolicy accessPolicy;
  private final FileRegistryProperties.Search searchSettings;

  public ScopedFileQueryService(
      SourceRegistry sourceRegistry,
      FileRegistry fileRegistry,
      AccessPolicy accessPolicy,
      FileRegistryProperties properties) {
    this.sourceRegistry = sourceRegistry;
    this.fileRegistry = fileRegistry;
    this.accessPolicy = accessPolicy;
    this.searchSettings = properties.getSearch();
  }

  public Set<String> allowedSources(CallerContext caller) {
    return sourceRegistry.list().stream()
        .map(RegisteredSource::slug)
        .filter(slug -> accessPolicy.isAllowed(caller, slug))
        .collect(Collectors.toCollection(LinkedHashSet::new));
  }

  public List<RegisteredSource> visibleSources(CallerContext caller) {
    return sourceRegistry.list().stream()
        .filter(source -> accessPolicy.isAllowed(caller, source.slug()))
        .collect(Collectors.toList());
  }

  public List<FileRecord> filterRecords(CallerContext caller, Collection<FileRecord> records) {
    Set<String> allowed = allowedSources(caller);
    return records.stream()
        .filter(record -> allowed.contains(record.getSourceSlug()))
        .collect(Collectors.toList());
  }

  public FileRecord get(CallerContext caller, String id) {
    return fileRegistry
        .find(id)
        .filter(record -> isVisible(caller, record))
        .orElseThrow(() -> new ResourceNotFoundException("File not found: " + id));
  }

  public List<FileRecord> getMany(CallerContext caller, Collection<String> ids) {
    if (ids.isEmpty() || allowedSources(caller).isEmpty()) {
      return List.of();
    }
    return filterRecords(caller, fileRegistry.getMany(ids));
  }

  public FileSearchResult search(CallerContext caller, String query, Integer limit, String cursor) {
    return fileRegistry.search(query, allowedSources(caller), effectiveLimit(limit), cursor);
  }

  /** Newest-first listing of one source. */
  public FileSearchResult listSource(
      CallerContext caller, String sourceSlug, Integer limit, String cursor) {
    RegisteredSource source = requireSource(caller, sourceSlug);
    return fileRegistry.search(null, Set.of(source.slug()), effectiveLimit(limit), cursor);
  }

  /** The source, unless it is unknown or hidden from the caller; both read as not found. */
  public RegisteredSource requireSource(CallerContext caller, String sourceSlug) {
    return sourceRegistry
        .find(sourceSlug)
        .filter(source -> accessPolicy.isAllowed(caller, source.slug()))
        .orElseThrow(() -> new SourceNotFoundException("Source not found: " + sourceSlug));
  }

  private boolean isVisible(CallerContext caller, FileRecord record) {
    return sourceRegistry.contains(record.getSourceSlug())
        && accessPolicy.isAllowed(caller, record.getSourceSlug());
  }

  int effectiveLimit(Integer requested) {
    if (requested == null || requested <= 0) {
      return searchSettings.getDefaultLimit();
    }
    return Math.min(requested, searchSettings.getMaxLimit());
  }
}
