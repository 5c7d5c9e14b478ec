package com.docstore.db;

import java.util.Optional;
import java.util.UUID;
import javax.annotation.Nullable;

/**
 * Represents a row in a document table.
 *
 * @param identifier The database-generated primary key
 * @param body The JSON document text, or null while the identifier is reserved but unwritten
 */
public record Document(UUID identifier, @Nullable String body) {

  /** Returns the body if one has been written. */
  public Optional<String> writtenBody() {
    return Optional.ofNullable(body);
  }
}
