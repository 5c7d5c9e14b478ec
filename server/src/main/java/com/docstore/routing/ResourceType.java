package com.docstore.routing;

import com.google.common.base.Preconditions;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * A document category such as {@code films}. Each type owns one table whose name equals the type
 * name, so the name is restricted to characters that are safe in an unquoted SQL identifier.
 *
 * @param name the lower-case type name used in URLs and as the table name
 */
public record ResourceType(String name) {

  // PostgreSQL truncates identifiers past 63 bytes; 54 leaves room for the "_body_idx" suffix.
  private static final Pattern VALID_NAME = Pattern.compile("[a-z][a-z0-9_]{0,53}");

  public ResourceType {
    Preconditions.checkArgument(
        name != null && VALID_NAME.matcher(name).matches(),
        "resource type must match %s, got '%s'",
        VALID_NAME,
        name);
  }

  /** Creates a type from a configured name, ignoring case. */
  public static ResourceType of(String name) {
    Preconditions.checkArgument(name != null, "resource type must not be null");
    return new ResourceType(name.toLowerCase(Locale.ROOT));
  }

  public String tableName() {
    return name;
  }

  /** Name of the generalized inverted index over the table's body column. */
  public String bodyIndexName() {
    return name + "_body_idx";
  }
}
