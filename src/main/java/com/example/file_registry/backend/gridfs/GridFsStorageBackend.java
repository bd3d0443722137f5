package com.example.file_registry.backend.gridfs;

import com.example.file_registry.backend.BackendFileMetadata;
import com.example.file_registry.backend.BackendSettings;
import com.example.file_registry.backend.FilePage;
import com.example.file_registry.backend.SecretResolver;
import com.example.file_registry.backend.StorageBackend;
import com.example.file_registry.backend.StorageCapabilities;
import com.example.file_registry.exception.BackendUnavailableException;
import com.example.file_registry.exception.ConfigurationException;
import com.example.file_registry.exception.DuplicatePathException;
import com.example.file_registry.exception.ResourceNotFoundException;
import com.example.file_registry.util.ContentHashes;
import com.example.file_registry.util.MimeUtil;
import com.mongodb.MongoException;
import com.mongodb.client.gridfs.model.GridFSFile;
import java.io.IOException;
import java.io.InputStream;
import java.security.DigestInputStream;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.convert.MongoConverter;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.data.mongodb.gridfs.GridFsResource;
import org.springframework.data.mongodb.gridfs.GridFsTemplate;

/**
 * Keeps bytes in a GridFS bucket of the application's MongoDB. The GridFS filename is the
 * backend-relative path and is unique within the bucket.
 *
 * <p>Settings: {@code bucket} (default {@value #DEFAULT_BUCKET}), {@code max_file_size}.
 */
public class GridFsStorageBackend implements StorageBackend {
  public static final String TYPE = "gridfs";
  static final String DEFAULT_BUCKET = "attachments";
  private static final Logger log = LoggerFactory.getLogger(GridFsStorageBackend.class);

  private final MongoDatabaseFactory databaseFactory;
  private final MongoConverter converter;
  private GridFsTemplate gridFsTemplate;
  private MongoTemplate mongoTemplate;
  private String filesCollection;
  private StorageCapabilities capabilities;

  public GridFsStorageBackend(MongoDatabaseFactory databaseFactory, MongoConverter converter) {
    this.databaseFactory = databaseFactory;
    this.converter = converter;
  }

  @Override
  public String storageType() {
    return TYPE;
  }

  @Override
  public void configure(Map<String, Object> settings, SecretResolver secrets) {
    BackendSettings config = new BackendSettings(TYPE, settings);
    String bucket = config.getString("bucket", DEFAULT_BUCKET);
    this.gridFsTemplate = new GridFsTemplate(databaseFactory, converter, bucket);
    this.mongoTemplate = new MongoTemplate(databaseFactory, converter);
    this.filesCollection = bucket + ".files";
    try {
      mongoTemplate
          .indexOps(filesCollection)
          .ensureIndex(new Index().on("filename", Sort.Direction.ASC).unique());
      log.info("Ensured unique index on 'filename' for collection: {}", filesCollection);
    } catch (DataAccessException | MongoException e) {
      throw new ConfigurationException("GridFS bucket '" + bucket + "' is not reachable", e);
    }
    this.capabilities =
        StorageCapabilities.builder()
            .canUpload(true)
            .canDelete(true)
            .canList(true)
            .requiresProxyDownload(true)
            .maxFileSize(config.getLong("max_file_size"))
            .build();
  }

  @Override
  public StorageCapabilities describeCapabilities() {
    return capabilities;
  }

  @Override
  public Optional<BackendFileMetadata> statFile(String path) {
    return findByPath(path).map(this::toMetadata);
  }

  @Override
  public byte[] readFile(String path) {
    try (InputStream in = openStream(path)) {
      return in.readAllBytes();
    } catch (IOException e) {
      throw new BackendUnavailableException("Cannot read " + path + " from GridFS", e);
    }
  }

  @Override
  public InputStream openStream(String path) {
    GridFSFile file =
        findByPath(path)
            .orElseThrow(() -> new ResourceNotFoundException("File not found: " + path));
    GridFsResource resource = gridFsTemplate.getResource(file);
    try {
      return resource.getInputStream();
    } catch (IOException | MongoException e) {
      throw new BackendUnavailableException("Cannot open " + path + " from GridFS", e);
    }
  }

  @Override
  public FilePage listFiles(String prefix, String cursor, int limit) {
    Criteria criteria = Criteria.where("filename");
    if (prefix != null && !prefix.isEmpty()) {
      criteria = criteria.regex("^" + Pattern.quote(prefix));
    } else {
      criteria = criteria.exists(true);
    }
    if (cursor != null) {
      criteria = criteria.gt(cursor);
    }
    Query query =
        Query.query(criteria).with(Sort.by(Sort.Direction.ASC, "filename")).limit(limit + 1);
    List<BackendFileMetadata> files = new ArrayList<>();
    try {
      for (GridFSFile file : gridFsTemplate.find(query)) {
        files.add(toMetadata(file));
      }
    } catch (DataAccessResourceFailureException | MongoException e) {
      throw new BackendUnavailableException("Cannot list GridFS bucket " + filesCollection, e);
    }
    if (files.size() > limit) {
      List<BackendFileMetadata> page = new ArrayList<>(files.subList(0, limit));
      return new FilePage(page, page.get(limit - 1).path());
    }
    return new FilePage(files, null);
  }

  @Override
  public BackendFileMetadata storeFile(
      String path, InputStream content, long size, String contentType) {
    if (findByPath(path).isPresent()) {
      throw new DuplicatePathException("Path already exists: " + path);
    }
    try {
      MimeUtil.Detected detected = MimeUtil.detect(content);
      String effectiveMimeType = contentType;
      if (effectiveMimeType == null
          || effectiveMimeType.isBlank()
          || MimeUtil.DEFAULT_CONTENT_TYPE.equals(effectiveMimeType)) {
        effectiveMimeType = detected.contentType;
      }
      if (effectiveMimeType == null || effectiveMimeType.isBlank()) {
        effectiveMimeType = MimeUtil.DEFAULT_CONTENT_TYPE;
      }

      Document gridFsMetadata = new Document().append("contentType", effectiveMimeType);

      ObjectId storedFileObjectId;
      String hash;
      try (DigestInputStream digestIn =
          new DigestInputStream(detected.stream, ContentHashes.newSha256())) {
        storedFileObjectId =
            gridFsTemplate.store(digestIn, path, effectiveMimeType, gridFsMetadata);
        hash = HexFormat.of().formatHex(digestIn.getMessageDigest().digest());
      }
      if (storedFileObjectId == null) {
        throw new BackendUnavailableException(
            "GridFS store operation returned no id for " + path);
      }

      Query byId = Query.query(Criteria.where("_id").is(storedFileObjectId));
      mongoTemplate.updateFirst(byId, new Update().set("metadata.sha256", hash), filesCollection);
      GridFSFile stored = gridFsTemplate.findOne(byId);
      log.info("Stored {} in GridFS as {} with hash {}", path, storedFileObjectId, hash);
      return toMetadata(stored);
    } catch (DuplicateKeyException e) {
      throw new DuplicatePathException("Path already exists: " + path, e);
    } catch (IOException | DataAccessResourceFailureException | MongoException e) {
      throw new BackendUnavailableException("Cannot store " + path + " in GridFS", e);
    }
  }

  @Override
  public void deleteFile(String path) {
    GridFSFile file =
        findByPath(path)
            .orElseThrow(() -> new ResourceNotFoundException("File not found: " + path));
    // delete by _id so that every chunk goes with the files document
    gridFsTemplate.delete(Query.query(Criteria.where("_id").is(file.getObjectId())));
    log.info("Deleted GridFS file {} ({})", path, file.getObjectId());
  }

  private Optional<GridFSFile> findByPath(String path) {
    try {
      return Optional.ofNullable(
          gridFsTemplate.findOne(Query.query(Criteria.where("filename").is(path))));
    } catch (DataAccessResourceFailureException | MongoException e) {
      throw new BackendUnavailableException("Cannot query GridFS for " + path, e);
    }
  }

  private BackendFileMetadata toMetadata(GridFSFile file) {
    Document metadata = file.getMetadata() == null ? new Document() : file.getMetadata();
    String path = file.getFilename();
    int slash = path.lastIndexOf('/');
    return BackendFileMetadata.builder()
        .path(path)
        .filename(slash >= 0 ? path.substring(slash + 1) : path)
        .contentType(metadata.getString("contentType"))
        .contentHash(ContentHashes.tagSha256Hex(metadata.getString("sha256")))
        .size(file.getLength())
        .createdAt(file.getUploadDate() == null ? null : file.getUploadDate().toInstant())
        .build();
  }
}
