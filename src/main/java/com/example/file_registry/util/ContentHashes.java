package com.example.file_registry.util;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;

/** Algorithm-tagged content hashes, e.g. {@code sha256:<hex>}. */
public final class ContentHashes {
  public static final String SHA256_PREFIX = "sha256:";
  private static final String HASH_ALGO = "SHA-256";
  private static final Pattern TAGGED_SHA256 = Pattern.compile("^sha256:[0-9a-f]{64}$");

  private ContentHashes() {}

  public static MessageDigest newSha256() {
    try {
      return MessageDigest.getInstance(HASH_ALGO);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException(HASH_ALGO + " is not available", e);
    }
  }

  public static String tagSha256(byte[] digest) {
    return tagSha256Hex(HexFormat.of().formatHex(digest));
  }

  public static String tagSha256Hex(String hex) {
    return hex == null ? null : SHA256_PREFIX + hex;
  }

  public static String sha256(byte[] content) {
    return tagSha256(newSha256().digest(content));
  }

  public static boolean isSha256(String hash) {
    return hash != null && TAGGED_SHA256.matcher(hash).matches();
  }

  /** The raw digest behind a {@code sha256:<hex>} hash. */
  public static byte[] sha256Digest(String hash) {
    if (!isSha256(hash)) {
      throw new IllegalArgumentException("Not a sha256 content hash: " + hash);
    }
    return HexFormat.of().parseHex(hash.substring(SHA256_PREFIX.length()));
  }
}
