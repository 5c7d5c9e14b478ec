package com.docstore.db;

import com.docstore.common.status.Status;
import com.docstore.common.status.StatusOr;
import com.docstore.db.util.DbUtil;
import com.docstore.routing.ResourceType;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Optional;
import java.util.UUID;
import javax.annotation.Nonnull;

/**
 * DAO helper for document tables. Every method issues exactly one statement against the table of
 * the given type; table names come from {@link ResourceType}, which only admits plain SQL
 * identifiers.
 */
public final class Documents {

  private Documents() {
    // Utility class
  }

  /**
   * Creates the table and its GIN index for a type if they do not exist yet.
   *
   * @param conn an open JDBC connection
   * @param type the resource type whose table to create
   */
  @Nonnull
  public static Status createTableIfMissing(Connection conn, ResourceType type) {
    String table =
        """
        CREATE TABLE IF NOT EXISTS %s (
            identifier UUID DEFAULT gen_random_uuid() PRIMARY KEY,
            body       JSONB
        )
        """
            .formatted(type.tableName());
    String index =
        "CREATE INDEX IF NOT EXISTS %s ON %s USING GIN (body)"
            .formatted(type.bodyIndexName(), type.tableName());
    try (Statement stmt = conn.createStatement()) {
      stmt.execute(table);
      stmt.execute(index);
      return Status.ok();
    } catch (SQLException e) {
      return DbUtil.toStoreStatus("create table " + type.tableName(), e);
    }
  }

  /**
   * Reserves a new row without a body.
   *
   * @param conn an open JDBC connection
   * @param type the resource type
   * @return StatusOr containing the generated identifier or an error
   */
  @Nonnull
  public static StatusOr<UUID> reserve(Connection conn, ResourceType type) {
    String sql = "INSERT INTO %s DEFAULT VALUES RETURNING identifier".formatted(type.tableName());
    try (PreparedStatement stmt = conn.prepareStatement(sql);
        ResultSet rs = stmt.executeQuery()) {
      return readGeneratedIdentifier(rs);
    } catch (SQLException e) {
      return StatusOr.ofStatus(DbUtil.toStoreStatus("reserve " + type.name(), e));
    }
  }

  /**
   * Inserts a new row with a body.
   *
   * @param conn an open JDBC connection
   * @param type the resource type
   * @param body JSON document text
   * @return StatusOr containing the generated identifier or an error
   */
  @Nonnull
  public static StatusOr<UUID> insert(Connection conn, ResourceType type, String body) {
    String sql =
        """
        INSERT INTO %s (body)
        VALUES (?)
        RETURNING identifier
        """
            .formatted(type.tableName());
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      DbUtil.setJsonbParameter(stmt, 1, body);
      try (ResultSet rs = stmt.executeQuery()) {
        return readGeneratedIdentifier(rs);
      }
    } catch (SQLException e) {
      return StatusOr.ofStatus(DbUtil.toStoreStatus("insert " + type.name(), e));
    }
  }

  /**
   * Loads a single row by identifier.
   *
   * @param conn an open JDBC connection
   * @param type the resource type
   * @param identifier the row key
   * @return StatusOr containing an Optional Document or an error
   */
  @Nonnull
  public static StatusOr<Optional<Document>> loadById(
      Connection conn, ResourceType type, UUID identifier) {
    String sql =
        """
        SELECT identifier, body
          FROM %s
         WHERE identifier = ?
        """
            .formatted(type.tableName());
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setObject(1, identifier);
      try (ResultSet rs = stmt.executeQuery()) {
        if (!rs.next()) {
          return StatusOr.ofValue(Optional.empty());
        }
        StatusOr<Document> documentOr = extractDocument(rs);
        if (documentOr.isNotOk()) {
          return StatusOr.ofStatus(documentOr.getStatus());
        }
        return StatusOr.ofValue(Optional.of(documentOr.getValue()));
      }
    } catch (SQLException e) {
      return StatusOr.ofStatus(DbUtil.toStoreStatus("load " + type.name(), e));
    }
  }

  /**
   * Overwrites the body of an existing row.
   *
   * @return StatusOr containing the number of affected rows (0 or 1) or an error
   */
  @Nonnull
  public static StatusOr<Integer> updateBody(
      Connection conn, ResourceType type, UUID identifier, String body) {
    String sql =
        """
        UPDATE %s
           SET body = ?
         WHERE identifier = ?
        """
            .formatted(type.tableName());
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      DbUtil.setJsonbParameter(stmt, 1, body);
      stmt.setObject(2, identifier);
      return StatusOr.ofValue(stmt.executeUpdate());
    } catch (SQLException e) {
      return StatusOr.ofStatus(DbUtil.toStoreStatus("update " + type.name(), e));
    }
  }

  /**
   * Inserts or replaces a row under a caller-supplied identifier (upsert).
   *
   * @return StatusOr containing the number of affected rows or an error
   */
  @Nonnull
  public static StatusOr<Integer> save(
      Connection conn, ResourceType type, UUID identifier, String body) {
    String sql =
        """
        INSERT INTO %s (identifier, body)
        VALUES (?, ?)
        ON CONFLICT (identifier)
        DO UPDATE SET body = excluded.body
        """
            .formatted(type.tableName());
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setObject(1, identifier);
      DbUtil.setJsonbParameter(stmt, 2, body);
      return StatusOr.ofValue(stmt.executeUpdate());
    } catch (SQLException e) {
      return StatusOr.ofStatus(DbUtil.toStoreStatus("save " + type.name(), e));
    }
  }

  /**
   * Deletes a row by identifier.
   *
   * @return StatusOr containing the number of affected rows (0 or 1) or an error
   */
  @Nonnull
  public static StatusOr<Integer> delete(Connection conn, ResourceType type, UUID identifier) {
    String sql =
        """
        DELETE FROM %s
         WHERE identifier = ?
        """
            .formatted(type.tableName());
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setObject(1, identifier);
      return StatusOr.ofValue(stmt.executeUpdate());
    } catch (SQLException e) {
      return StatusOr.ofStatus(DbUtil.toStoreStatus("delete " + type.name(), e));
    }
  }

  @Nonnull
  private static StatusOr<UUID> readGeneratedIdentifier(ResultSet rs) throws SQLException {
    if (!rs.next()) {
      return StatusOr.ofStatus(Status.storeError("Insert returned no identifier", null));
    }
    return DbUtil.getUuid(rs, "identifier");
  }

  /** Extracts a Document from the current row of a ResultSet. */
  @Nonnull
  private static StatusOr<Document> extractDocument(ResultSet rs) {
    StatusOr<UUID> identifierOr = DbUtil.getUuid(rs, "identifier");
    if (identifierOr.isNotOk()) {
      return StatusOr.ofStatus(identifierOr.getStatus());
    }
    StatusOr<Optional<String>> bodyOr = DbUtil.getOptionalJsonb(rs, "body");
    if (bodyOr.isNotOk()) {
      return StatusOr.ofStatus(bodyOr.getStatus());
    }
    return StatusOr.ofValue(new Document(identifierOr.getValue(), bodyOr.getValue().orElse(null)));
  }
}
