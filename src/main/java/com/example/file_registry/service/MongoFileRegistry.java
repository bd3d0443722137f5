package com.example.file_registry.service;

import com.example.file_registry.exception.DuplicatePathException;
import com.example.file_registry.exception.InvalidRequestArgumentException;
import com.example.file_registry.exception.ResourceNotFoundException;
import com.example.file_registry.model.FileRecord;
import com.example.file_registry.model.FileSearchResult;
import com.example.file_registry.repository.FileRecordRepository;
import com.example.file_registry.util.FileIds;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

@Service
public class MongoFileRegistry implements FileRegistry {
  private static final Logger log = LoggerFactory.getLogger(MongoFileRegistry.class);

  private final FileRecordRepository fileRecordRepository;
  private final MongoTemplate mongoTemplate;
  private final SourceRegistry sourceRegistry;

  public MongoFileRegistry(
      FileRecordRepository fileRecordRepository,
      MongoTemplate mongoTemplate,
      SourceRegistry sourceRegistry) {
    this.fileRecordRepository = fileRecordRepository;
    this.mongoTemplate = mongoTemplate;
    this.sourceRegistry = sourceRegistry;
  }

  @Override
  public FileRecord insert(FileRecord record) {
    sourceRegistry.get(record.getSourceSlug());
    String id = record.getId() == null ? FileIds.newId() : record.getId();
    if (!FileIds.isValid(id)) {
      throw new InvalidRequestArgumentException("Invalid file id: " + id);
    }
    FileRecord toInsert =
        record.toBuilder()
            .id(id)
            .createdAt(record.getCreatedAt() == null ? Instant.now() : record.getCreatedAt())
            .build();
    try {
      // insert, never save: the unique index has to reject a taken (source, path)
      FileRecord inserted = fileRecordRepository.insert(toInsert);
      log.debug("Inserted {} at {}:{}", id, inserted.getSourceSlug(), inserted.getPath());
      return inserted;
    } catch (DuplicateKeyException e) {
      log.warn(
          "Rejected duplicate record {} for {}:{}", id, record.getSourceSlug(), record.getPath());
      throw new DuplicatePathException(
          "Path already registered in source '"
              + record.getSourceSlug()
              + "': "
              + record.getPath(),
          e);
    }
  }

  @Override
  public Optional<FileRecord> find(String id) {
    if (!FileIds.isValid(id)) {
      return Optional.empty();
    }
    return fileRecordRepository.findById(id);
  }

  @Override
  public FileRecord get(String id) {
    return find(id).orElseThrow(() -> new ResourceNotFoundException("File not found: " + id));
  }

  @Override
  public List<FileRecord> getMany(Collection<String> ids) {
    List<String> valid =
        ids.stream().filter(FileIds::isValid).distinct().collect(Collectors.toList());
    if (valid.isEmpty()) {
      return List.of();
    }
    List<FileRecord> found = new ArrayList<>();
    fileRecordRepository.findAllById(valid).forEach(found::add);
    return found;
  }

  @Override
  public FileSearchResult search(
      String query, Set<String> allowedSources, int limit, String cursor) {
    if (allowedSources.isEmpty() || limit <= 0) {
      return new FileSearchResult(List.of(), null, Set.of());
    }
    Criteria matching = Criteria.where("sourceSlug").in(allowedSources);
    if (query != null && !query.isBlank()) {
      Pattern pattern = Pattern.compile(Pattern.quote(query.trim()), Pattern.CASE_INSENSITIVE);
      matching =
          new Criteria()
              .andOperator(
                  matching,
                  new Criteria()
                      .orOperator(
                          Criteria.where("filename").regex(pattern),
                          Criteria.where("contentType").regex(pattern),
                          Criteria.where("annotation").regex(pattern)));
    }

    Set<String> searchedSources =
        new TreeSet<>(
            mongoTemplate.findDistinct(
                Query.query(matching), "sourceSlug", FileRecord.class, String.class));

    Query page = Query.query(matching);
    if (cursor != null && !cursor.isBlank()) {
      page.addCriteria(Criteria.where("id").lt(cursor));
    }
    page.with(Sort.by(Sort.Direction.DESC, "id")).limit(limit + 1);
    List<FileRecord> records = mongoTemplate.find(page, FileRecord.class);

    String nextCursor = null;
    if (records.size() > limit) {
      records = new ArrayList<>(records.subList(0, limit));
      nextCursor = records.get(limit - 1).getId();
    }
    return new FileSearchResult(records, nextCursor, searchedSources);
  }

  @Override
  public boolean existsBySourceAndPath(String sourceSlug, String path) {
    return fileRecordRepository.existsBySourceSlugAndPath(sourceSlug, path);
  }

  @Override
  public List<FileRecord> listBySource(String sourceSlug) {
    try (Stream<FileRecord> records = fileRecordRepository.streamBySourceSlug(sourceSlug)) {
      return records.collect(Collectors.toList());
    }
  }

  @Override
  public FileRecord updateAnnotation(String id, String annotation) {
    if (!FileIds.isValid(id)) {
      throw new ResourceNotFoundException("File not found: " + id);
    }
    Update update =
        annotation == null
            ? new Update().unset("annotation")
            : Update.update("annotation", annotation);
    FileRecord updated =
        mongoTemplate.findAndModify(
            Query.query(Criteria.where("id").is(id)),
            update,
            FindAndModifyOptions.options().returnNew(true),
            FileRecord.class);
    if (updated == null) {
      throw new ResourceNotFoundException("File not found: " + id);
    }
    return updated;
  }

  @Override
  public boolean delete(String id) {
    if (!FileIds.isValid(id)) {
      return false;
    }
    Query byId = Query.query(Criteria.where("id").is(id));
    return mongoTemplate.remove(byId, FileRecord.class).getDeletedCount() > 0;
  }
}
