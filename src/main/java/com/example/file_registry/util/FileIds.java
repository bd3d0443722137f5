package com.example.file_registry.util;

import com.github.f4b6a3.ulid.Ulid;
import com.github.f4b6a3.ulid.UlidCreator;
import java.time.Instant;
import java.util.regex.Pattern;

/**
 * File record identifiers: the {@code df-} type tag followed by a lowercase ULID. Ids come from
 * the monotonic generator, so ids generated by one process are strictly increasing, including
 * within the same millisecond.
 */
public final class FileIds {
  public static final String PREFIX = "df-";

  private static final Pattern ID_PATTERN =
      Pattern.compile("^" + PREFIX + "[0-7][0-9a-hjkmnp-tv-z]{25}$");

  private FileIds() {}

  public static String newId() {
    return PREFIX + UlidCreator.getMonotonicUlid().toLowerCase();
  }

  public static boolean isValid(String id) {
    return id != null && ID_PATTERN.matcher(id).matches();
  }

  /** The sortable part without the type tag; used as the directory of a stored file. */
  public static String ulidPart(String id) {
    if (!isValid(id)) {
      throw new IllegalArgumentException("Not a file id: " + id);
    }
    return id.substring(PREFIX.length());
  }

  static Instant timestampOf(String id) {
    return Ulid.from(ulidPart(id)).getInstant();
  }
}
