package com.docstore.store;

import com.docstore.common.status.Status;
import com.docstore.common.status.StatusOr;
import com.docstore.routing.ResourceType;
import java.util.UUID;
import javax.annotation.Nonnull;

/**
 * Persistence contract for JSON documents. Each call is one round trip and one statement, atomic
 * at the row level and independent of every other call. Bodies are opaque JSON text; the store
 * never interprets their shape.
 *
 * <p>Implementations must be safe for concurrent use without external locking.
 */
public interface DocumentStore {

  /**
   * Reserves a fresh identifier. The row exists afterwards with no body, so a following
   * {@link #replace} succeeds while {@link #get} still reports NOT_FOUND.
   */
  @Nonnull
  StatusOr<UUID> allocate(ResourceType type);

  /** Stores a new document under a fresh identifier. */
  @Nonnull
  StatusOr<UUID> create(ResourceType type, String body);

  /**
   * Returns the stored body, or NOT_FOUND if there is no row or the row is reserved but has never
   * been written.
   */
  @Nonnull
  StatusOr<String> get(ResourceType type, UUID identifier);

  /** Overwrites the body of an existing row, or returns NOT_FOUND. */
  @Nonnull
  Status replace(ResourceType type, UUID identifier, String body);

  /** Overwrites the body of a row, inserting the row under {@code identifier} if needed. */
  @Nonnull
  Status upsert(ResourceType type, UUID identifier, String body);

  /** Removes a row, or returns NOT_FOUND. */
  @Nonnull
  Status delete(ResourceType type, UUID identifier);

  /** Returns true when the backing store answers. */
  boolean isReady();
}
