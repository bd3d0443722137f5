package com.example.file_registry.backend.s3;

import com.example.file_registry.backend.BackendFileMetadata;
import com.example.file_registry.backend.BackendSettings;
import com.example.file_registry.backend.FilePage;
import com.example.file_registry.backend.SecretResolver;
import com.example.file_registry.backend.SignedUrl;
import com.example.file_registry.backend.StorageBackend;
import com.example.file_registry.backend.StorageCapabilities;
import com.example.file_registry.backend.UploadInstructions;
import com.example.file_registry.exception.BackendUnavailableException;
import com.example.file_registry.exception.ConfigurationException;
import com.example.file_registry.exception.DuplicatePathException;
import com.example.file_registry.exception.ResourceNotFoundException;
import com.example.file_registry.exception.StorageException;
import com.example.file_registry.util.ContentHashes;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.model.ChecksumMode;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;
import software.amazon.awssdk.services.s3.presigner.model.PresignedGetObjectRequest;
import software.amazon.awssdk.services.s3.presigner.model.PresignedPutObjectRequest;
import software.amazon.awssdk.services.s3.presigner.model.PutObjectPresignRequest;

/**
 * S3 (or S3-compatible) backend. All AWS SDK types are confined to this class.
 *
 * <p>Settings: {@code bucket} (required), {@code region} (default us-east-1), {@code endpoint},
 * {@code path_style}, {@code prefix}, {@code access_key_secret} and {@code secret_key_secret}
 * (names of secrets to resolve; the default AWS credentials chain is used when both are absent),
 * {@code direct_upload}, {@code validate_bucket}, {@code max_file_size}.
 */
public class S3StorageBackend implements StorageBackend {
  public static final String TYPE = "s3";
  static final String SHA256_METADATA_KEY = "sha256";
  static final String CHECKSUM_SHA256_HEADER = "x-amz-checksum-sha256";
  private static final Logger log = LoggerFactory.getLogger(S3StorageBackend.class);

  private S3Client s3Client;
  private S3Presigner s3Presigner;
  private String bucketName;
  private String keyPrefix;
  private StorageCapabilities capabilities;

  public S3StorageBackend() {}

  /** Uses the given clients instead of building them from the settings. */
  S3StorageBackend(S3Client s3Client, S3Presigner s3Presigner) {
    this.s3Client = s3Client;
    this.s3Presigner = s3Presigner;
  }

  @Override
  public String storageType() {
    return TYPE;
  }

  @Override
  public void configure(Map<String, Object> settings, SecretResolver secrets) {
    BackendSettings config = new BackendSettings(TYPE, settings);
    this.bucketName = config.requireString("bucket");
    this.keyPrefix = trimSlashes(config.getString("prefix", ""));
    if (s3Client == null) {
      buildClients(config, secrets);
    }
    if (config.getBoolean("validate_bucket", false)) {
      try {
        s3Client.headBucket(HeadBucketRequest.builder().bucket(bucketName).build());
      } catch (S3Exception | SdkClientException e) {
        throw new ConfigurationException("Bucket '" + bucketName + "' is not reachable", e);
      }
    }
    this.capabilities =
        StorageCapabilities.builder()
            .canUpload(true)
            .canDelete(true)
            .canList(true)
            .canGenerateSignedUrls(true)
            .requiresDirectUpload(config.getBoolean("direct_upload", false))
            .maxFileSize(config.getLong("max_file_size"))
            .build();
    log.info("S3 storage configured for bucket {} (prefix '{}')", bucketName, keyPrefix);
  }

  private void buildClients(BackendSettings config, SecretResolver secrets) {
    Region region = Region.of(config.getString("region", "us-east-1"));
    String endpoint = config.getString("endpoint", null);
    boolean pathStyle = config.getBoolean("path_style", false);
    AwsCredentialsProvider credentials = credentials(config, secrets);

    S3ClientBuilder clientBuilder =
        S3Client.builder()
            .region(region)
            .credentialsProvider(credentials)
            .forcePathStyle(pathStyle);
    S3Presigner.Builder presignerBuilder =
        S3Presigner.builder()
            .region(region)
            .credentialsProvider(credentials)
            .serviceConfiguration(
                S3Configuration.builder().pathStyleAccessEnabled(pathStyle).build());
    if (endpoint != null && !endpoint.isBlank()) {
      URI endpointUri = URI.create(endpoint);
      clientBuilder.endpointOverride(endpointUri);
      presignerBuilder.endpointOverride(endpointUri);
    }
    this.s3Client = clientBuilder.build();
    this.s3Presigner = presignerBuilder.build();
  }

  private AwsCredentialsProvider credentials(BackendSettings config, SecretResolver secrets) {
    String accessKeySecret = config.getString("access_key_secret", null);
    String secretKeySecret = config.getString("secret_key_secret", null);
    if (accessKeySecret == null && secretKeySecret == null) {
      return DefaultCredentialsProvider.create();
    }
    if (accessKeySecret == null || secretKeySecret == null) {
      throw new ConfigurationException(
          "Both access_key_secret and secret_key_secret must be set, or neither");
    }
    String accessKey = resolveSecret(secrets, accessKeySecret);
    String secretKey = resolveSecret(secrets, secretKeySecret);
    return StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKey, secretKey));
  }

  private static String resolveSecret(SecretResolver secrets, String name) {
    return secrets
        .getSecret(name)
        .filter(value -> !value.isBlank())
        .orElseThrow(() -> new ConfigurationException("Secret '" + name + "' is not available"));
  }

  @Override
  public StorageCapabilities describeCapabilities() {
    return capabilities;
  }

  @Override
  public Optional<BackendFileMetadata> statFile(String path) {
    try {
      HeadObjectResponse head =
          s3Client.headObject(
              HeadObjectRequest.builder()
                  .bucket(bucketName)
                  .key(key(path))
                  .checksumMode(ChecksumMode.ENABLED)
                  .build());
      return Optional.of(
          BackendFileMetadata.builder()
              .path(path)
              .filename(lastSegment(path))
              .contentType(head.contentType())
              .contentHash(contentHash(head))
              .size(head.contentLength())
              .createdAt(head.lastModified())
              .build());
    } catch (NoSuchKeyException e) {
      return Optional.empty();
    } catch (S3Exception e) {
      if (e.statusCode() == 404) {
        return Optional.empty();
      }
      throw translate("stat", path, e);
    } catch (SdkClientException e) {
      throw translate("stat", path, e);
    }
  }

  @Override
  public byte[] readFile(String path) {
    var getRequest = GetObjectRequest.builder().bucket(bucketName).key(key(path)).build();
    try {
      ResponseBytes<GetObjectResponse> response = s3Client.getObjectAsBytes(getRequest);
      return response.asByteArray();
    } catch (NoSuchKeyException e) {
      throw new ResourceNotFoundException("File not found: " + path, e);
    } catch (S3Exception | SdkClientException e) {
      throw translate("read", path, e);
    }
  }

  @Override
  public FilePage listFiles(String prefix, String cursor, int limit) {
    String listPrefix = key(prefix == null ? "" : prefix);
    var request =
        ListObjectsV2Request.builder()
            .bucket(bucketName)
            .prefix(listPrefix.isEmpty() ? null : listPrefix)
            .continuationToken(cursor)
            .maxKeys(limit)
            .build();
    try {
      ListObjectsV2Response response = s3Client.listObjectsV2(request);
      List<BackendFileMetadata> files =
          response.contents().stream().map(this::toMetadata).collect(Collectors.toList());
      String next =
          Boolean.TRUE.equals(response.isTruncated()) ? response.nextContinuationToken() : null;
      return new FilePage(files, next);
    } catch (S3Exception | SdkClientException e) {
      throw translate("list", listPrefix, e);
    }
  }

  @Override
  public BackendFileMetadata storeFile(
      String path, InputStream content, long size, String contentType) {
    if (statFile(path).isPresent()) {
      throw new DuplicatePathException("Path already exists: " + path);
    }
    byte[] bytes;
    try {
      bytes = content.readAllBytes();
    } catch (IOException e) {
      throw new StorageException("Cannot read upload content for " + path, e);
    }
    String hash = ContentHashes.sha256(bytes);
    var putRequest =
        PutObjectRequest.builder()
            .bucket(bucketName)
            .key(key(path))
            .contentType(contentType)
            .metadata(
                Map.of(SHA256_METADATA_KEY, hash.substring(ContentHashes.SHA256_PREFIX.length())))
            .build();
    try {
      s3Client.putObject(putRequest, RequestBody.fromBytes(bytes));
    } catch (S3Exception | SdkClientException e) {
      throw translate("store", path, e);
    }
    return BackendFileMetadata.builder()
        .path(path)
        .filename(lastSegment(path))
        .contentType(contentType)
        .contentHash(hash)
        .size((long) bytes.length)
        .build();
  }

  @Override
  public void deleteFile(String path) {
    // S3 deletes are idempotent, so absence has to be checked explicitly
    if (statFile(path).isEmpty()) {
      throw new ResourceNotFoundException("File not found: " + path);
    }
    try {
      s3Client.deleteObject(
          DeleteObjectRequest.builder().bucket(bucketName).key(key(path)).build());
    } catch (S3Exception | SdkClientException e) {
      throw translate("delete", path, e);
    }
  }

  @Override
  public SignedUrl signedDownloadUrl(String path, Duration ttl) {
    var getRequest = GetObjectRequest.builder().bucket(bucketName).key(key(path)).build();
    var presignRequest =
        GetObjectPresignRequest.builder()
            .signatureDuration(ttl)
            .getObjectRequest(getRequest)
            .build();
    PresignedGetObjectRequest presigned = s3Presigner.presignGetObject(presignRequest);
    return new SignedUrl(presigned.url().toExternalForm(), Instant.now().plus(ttl));
  }

  @Override
  public UploadInstructions prepareDirectUpload(
      String path, String contentType, long size, String contentHash, Duration ttl) {
    String checksum =
        contentHash == null
            ? null
            : Base64.getEncoder().encodeToString(ContentHashes.sha256Digest(contentHash));
    var putRequest =
        PutObjectRequest.builder()
            .bucket(bucketName)
            .key(key(path))
            .contentType(contentType)
            .checksumSHA256(checksum)
            .build();
    var presignRequest =
        PutObjectPresignRequest.builder()
            .signatureDuration(ttl)
            .putObjectRequest(putRequest)
            .build();
    PresignedPutObjectRequest presigned = s3Presigner.presignPutObject(presignRequest);

    // the client must replay every signed header except host
    Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    if (presigned.signedHeaders() != null) {
      presigned
          .signedHeaders()
          .forEach(
              (name, values) -> {
                if (!"host".equalsIgnoreCase(name) && values != null && !values.isEmpty()) {
                  headers.put(name, String.join(",", values));
                }
              });
    }
    headers.putIfAbsent("Content-Type", contentType);
    if (checksum != null) {
      // S3 rejects the PUT unless the body hashes to this value
      headers.putIfAbsent(CHECKSUM_SHA256_HEADER, checksum);
    }
    return new UploadInstructions(
        presigned.url().toExternalForm(), "PUT", headers, Map.of(), Instant.now().plus(ttl));
  }

  /**
   * Objects stored through the host carry their hash as user metadata; direct uploads that declared
   * one carry it as the S3 SHA-256 checksum.
   */
  private static String contentHash(HeadObjectResponse head) {
    String hex = head.metadata() == null ? null : head.metadata().get(SHA256_METADATA_KEY);
    if (hex != null) {
      return ContentHashes.tagSha256Hex(hex);
    }
    String checksum = head.checksumSHA256();
    if (checksum == null || checksum.contains("-")) {
      // composite checksums of multipart uploads are not a hash of the whole object
      return null;
    }
    try {
      byte[] digest = Base64.getDecoder().decode(checksum);
      return digest.length == 32 ? ContentHashes.tagSha256(digest) : null;
    } catch (IllegalArgumentException e) {
      log.warn("Ignoring malformed SHA-256 checksum '{}'", checksum);
      return null;
    }
  }

  private BackendFileMetadata toMetadata(S3Object object) {
    String path = stripPrefix(object.key());
    return BackendFileMetadata.builder()
        .path(path)
        .filename(lastSegment(path))
        .size(object.size())
        .createdAt(object.lastModified())
        .build();
  }

  private String key(String path) {
    return keyPrefix.isEmpty() ? path : keyPrefix + "/" + path;
  }

  private String stripPrefix(String key) {
    return keyPrefix.isEmpty() ? key : key.substring(keyPrefix.length() + 1);
  }

  private static String lastSegment(String path) {
    int slash = path.lastIndexOf('/');
    return slash >= 0 ? path.substring(slash + 1) : path;
  }

  private static String trimSlashes(String value) {
    String trimmed = value.trim();
    while (trimmed.startsWith("/")) trimmed = trimmed.substring(1);
    while (trimmed.endsWith("/")) trimmed = trimmed.substring(0, trimmed.length() - 1);
    return trimmed;
  }

  private RuntimeException translate(String operation, String path, RuntimeException e) {
    if (e instanceof SdkClientException
        || (e instanceof S3Exception && ((S3Exception) e).statusCode() >= 500)) {
      log.warn("S3 {} failed for key {}: {}", operation, path, e.getMessage());
      return new BackendUnavailableException("S3 " + operation + " failed for " + path, e);
    }
    return new StorageException("S3 " + operation + " rejected for " + path, e);
  }
}
