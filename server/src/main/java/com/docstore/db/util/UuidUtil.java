package com.docstore.db.util;

import com.docstore.common.status.Status;
import com.docstore.common.status.StatusOr;
import java.util.UUID;
import java.util.regex.Pattern;
import javax.annotation.Nonnull;

/** Utility methods for working with UUIDs. */
public final class UuidUtil {

  // UUID.fromString also accepts shortened groups such as "1-2-3-4-5"; only the canonical
  // 8-4-4-4-12 form is a valid document identifier.
  private static final Pattern CANONICAL =
      Pattern.compile(
          "[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");

  private UuidUtil() {
    // Utility class, no instances
  }

  /**
   * Parses a canonical UUID string.
   *
   * @param str The string representation of the UUID
   * @return StatusOr containing the UUID or an INVALID_ADDRESS status
   */
  @Nonnull
  public static StatusOr<UUID> fromString(String str) {
    if (str == null || str.isEmpty()) {
      return StatusOr.ofStatus(Status.invalidAddress("Identifier cannot be null or empty"));
    }
    if (!CANONICAL.matcher(str).matches()) {
      return StatusOr.ofStatus(Status.invalidAddress("Invalid identifier: " + str));
    }
    return StatusOr.ofValue(UUID.fromString(str));
  }
}
