package com.docstore.store;

import com.docstore.common.status.Status;
import com.docstore.common.status.StatusOr;
import com.docstore.db.Document;
import com.docstore.db.Documents;
import com.docstore.db.util.DbUtil;
import com.docstore.routing.ResourceType;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import javax.annotation.Nonnull;
import javax.sql.DataSource;
import org.tinylog.Logger;

/**
 * {@link DocumentStore} over a pooled {@link DataSource}. Each call borrows one connection for one
 * statement; the pool is the only shared state and handles its own locking.
 *
 * <p>The readiness check runs on a background thread and is bounded by the ready timeout, since
 * borrowing a connection from an unreachable database blocks for the pool's whole connection
 * timeout. While a check is still running, later probes wait on the same check.
 */
public class JdbcDocumentStore implements DocumentStore {

  private static final Duration DEFAULT_READY_TIMEOUT = Duration.ofSeconds(2);

  private final DataSource dataSource;
  private final Duration readyTimeout;
  private final ExecutorService readinessExecutor =
      Executors.newSingleThreadExecutor(
          new ThreadFactoryBuilder().setNameFormat("readiness-check-%d").setDaemon(true).build());
  private CompletableFuture<Boolean> readinessCheck;

  public JdbcDocumentStore(DataSource dataSource) {
    this(dataSource, DEFAULT_READY_TIMEOUT);
  }

  /**
   * @param dataSource the connection pool
   * @param readyTimeout how long {@link #isReady()} waits for a validated connection
   */
  public JdbcDocumentStore(DataSource dataSource, Duration readyTimeout) {
    this.dataSource = dataSource;
    this.readyTimeout = readyTimeout;
  }

  @Override
  @Nonnull
  public StatusOr<UUID> allocate(ResourceType type) {
    try (Connection conn = dataSource.getConnection()) {
      return Documents.reserve(conn, type);
    } catch (SQLException e) {
      return StatusOr.ofStatus(DbUtil.toStoreStatus("connect for allocate", e));
    }
  }

  @Override
  @Nonnull
  public StatusOr<UUID> create(ResourceType type, String body) {
    try (Connection conn = dataSource.getConnection()) {
      return Documents.insert(conn, type, body);
    } catch (SQLException e) {
      return StatusOr.ofStatus(DbUtil.toStoreStatus("connect for create", e));
    }
  }

  @Override
  @Nonnull
  public StatusOr<String> get(ResourceType type, UUID identifier) {
    StatusOr<Optional<Document>> documentOr;
    try (Connection conn = dataSource.getConnection()) {
      documentOr = Documents.loadById(conn, type, identifier);
    } catch (SQLException e) {
      return StatusOr.ofStatus(DbUtil.toStoreStatus("connect for get", e));
    }
    if (documentOr.isNotOk()) {
      return StatusOr.ofStatus(documentOr.getStatus());
    }
    Optional<Document> document = documentOr.getValue();
    if (document.isEmpty()) {
      return StatusOr.ofStatus(Status.notFound(notFoundMessage(type, identifier)));
    }
    return StatusOr.fromOptional(
        document.get().writtenBody(),
        type.name() + " " + identifier + " is reserved but has no body yet");
  }

  @Override
  @Nonnull
  public Status replace(ResourceType type, UUID identifier, String body) {
    try (Connection conn = dataSource.getConnection()) {
      return expectOneRow(Documents.updateBody(conn, type, identifier, body), type, identifier);
    } catch (SQLException e) {
      return DbUtil.toStoreStatus("connect for replace", e);
    }
  }

  @Override
  @Nonnull
  public Status upsert(ResourceType type, UUID identifier, String body) {
    try (Connection conn = dataSource.getConnection()) {
      return Documents.save(conn, type, identifier, body).getStatus();
    } catch (SQLException e) {
      return DbUtil.toStoreStatus("connect for upsert", e);
    }
  }

  @Override
  @Nonnull
  public Status delete(ResourceType type, UUID identifier) {
    try (Connection conn = dataSource.getConnection()) {
      return expectOneRow(Documents.delete(conn, type, identifier), type, identifier);
    } catch (SQLException e) {
      return DbUtil.toStoreStatus("connect for delete", e);
    }
  }

  @Override
  public boolean isReady() {
    CompletableFuture<Boolean> check = currentReadinessCheck();
    try {
      return check.get(readyTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      Logger.warn("Readiness check did not get a database connection within {}", readyTimeout);
      return false;
    } catch (ExecutionException e) {
      Logger.warn(e.getCause(), "Readiness check failed");
      return false;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private synchronized CompletableFuture<Boolean> currentReadinessCheck() {
    if (readinessCheck == null || readinessCheck.isDone()) {
      readinessCheck = CompletableFuture.supplyAsync(this::validateConnection, readinessExecutor);
    }
    return readinessCheck;
  }

  private boolean validateConnection() {
    try (Connection conn = dataSource.getConnection()) {
      return conn.isValid(Math.max(1, (int) readyTimeout.toSeconds()));
    } catch (SQLException e) {
      Logger.warn(e, "Readiness check could not obtain a database connection");
      return false;
    }
  }

  private static Status expectOneRow(
      StatusOr<Integer> rowsOr, ResourceType type, UUID identifier) {
    if (rowsOr.isNotOk()) {
      return rowsOr.getStatus();
    }
    if (rowsOr.getValue() == 0) {
      return Status.notFound(notFoundMessage(type, identifier));
    }
    return Status.ok();
  }

  private static String notFoundMessage(ResourceType type, UUID identifier) {
    return "No " + type.name() + " document with identifier " + identifier;
  }
}
