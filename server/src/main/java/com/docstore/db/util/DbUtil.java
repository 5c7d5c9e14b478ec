package com.docstore.db.util;

import com.docstore.common.status.Status;
import com.docstore.common.status.StatusOr;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.Types;
import java.util.Optional;
import java.util.UUID;
import javax.annotation.Nonnull;

/** Utility methods for database operations. */
public final class DbUtil {

  /** PostgreSQL SQLSTATE for a statement cancelled by {@code statement_timeout}. */
  public static final String QUERY_CANCELED = "57014";

  /** PostgreSQL SQLSTATE class for data exceptions, such as a value JSONB cannot hold. */
  public static final String DATA_EXCEPTION_CLASS = "22";

  /** PostgreSQL SQLSTATE for a unique or primary key violation. */
  public static final String UNIQUE_VIOLATION = "23505";

  private DbUtil() {
    // Utility class, no instances
  }

  /** Gets a UUID from a ResultSet column using column name. */
  @Nonnull
  public static StatusOr<UUID> getUuid(ResultSet rs, String columnName) {
    try {
      UUID uuid = rs.getObject(columnName, UUID.class);
      if (rs.wasNull() || uuid == null) {
        return StatusOr.ofStatus(
            Status.storeError("Column " + columnName + " is null", null));
      }
      return StatusOr.ofValue(uuid);
    } catch (SQLException e) {
      return StatusOr.ofStatus(toStoreStatus("read " + columnName, e));
    }
  }

  /**
   * Reads a JSONB column as its text form, or empty when the column is SQL NULL.
   *
   * @param rs The ResultSet positioned on a row
   * @param columnName The name of the JSONB column
   */
  @Nonnull
  public static StatusOr<Optional<String>> getOptionalJsonb(ResultSet rs, String columnName) {
    try {
      String json = rs.getString(columnName);
      if (rs.wasNull() || json == null) {
        return StatusOr.ofValue(Optional.empty());
      }
      return StatusOr.ofValue(Optional.of(json));
    } catch (SQLException e) {
      return StatusOr.ofStatus(toStoreStatus("read " + columnName, e));
    }
  }

  /**
   * Binds JSON text to a JSONB parameter. The text is sent untyped so the server performs the cast
   * and rejects anything that is not JSON.
   *
   * @param stmt The PreparedStatement to set the parameter in
   * @param parameterIndex The index of the parameter to set (1-based)
   * @param json The JSON document text
   */
  public static void setJsonbParameter(PreparedStatement stmt, int parameterIndex, String json)
      throws SQLException {
    stmt.setObject(parameterIndex, json, Types.OTHER);
  }

  /**
   * Converts a driver exception into a status whose message names the operation and the SQLSTATE.
   * Data exceptions (class 22) mean the database refused the submitted document and become
   * INVALID_BODY; everything else is STORE_ERROR.
   */
  @Nonnull
  public static Status toStoreStatus(String operation, SQLException e) {
    String state = e.getSQLState();
    if (state != null && state.startsWith(DATA_EXCEPTION_CLASS)) {
      return Status.invalidBody(
          operation + " rejected the document (SQLSTATE " + state + "): " + e.getMessage());
    }
    String reason;
    if (e instanceof SQLTimeoutException || QUERY_CANCELED.equals(state)) {
      reason = "timed out";
    } else if (UNIQUE_VIOLATION.equals(state)) {
      reason = "identifier conflict";
    } else if (state != null && state.startsWith("08")) {
      reason = "connection failure";
    } else {
      reason = "failed";
    }
    return Status.storeError(
        operation + " " + reason + " (SQLSTATE " + state + "): " + e.getMessage(), e);
  }
}
