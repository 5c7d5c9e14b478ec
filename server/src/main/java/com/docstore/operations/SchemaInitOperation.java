package com.docstore.operations;

import com.docstore.common.status.Status;
import com.docstore.db.Documents;
import com.docstore.routing.ResourceType;
import com.google.common.collect.ImmutableList;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Collection;
import java.util.List;
import javax.sql.DataSource;
import org.tinylog.Logger;

/**
 * Creates the document table and body index for every configured resource type. Safe to run on
 * every start; existing tables are left untouched.
 */
public class SchemaInitOperation {
    private final Connection dbConnection;
    private final Collection<ResourceType> types;

    /**
     * @param dbConnection the database connection to use
     * @param types the resource types whose tables must exist
     */
    public SchemaInitOperation(Connection dbConnection, Collection<ResourceType> types) {
        this.dbConnection = dbConnection;
        this.types = types;
    }

    /**
     * Result of the schema initialization.
     */
    public record InitResult(List<String> tables, String errorMessage) {

        public static InitResult success(List<String> tables) {
            return new InitResult(ImmutableList.copyOf(tables), null);
        }

        public static InitResult error(List<String> tablesSoFar, String errorMessage) {
            return new InitResult(ImmutableList.copyOf(tablesSoFar), errorMessage);
        }

        public boolean isSuccess() {
            return errorMessage == null;
        }
    }

    /**
     * Ensures every table exists, stopping at the first failure.
     *
     * @return the tables ensured, and the error that stopped the run if any
     */
    public InitResult execute() {
        Logger.info("Ensuring document tables for {} resource type(s)", types.size());

        ImmutableList.Builder<String> ensured = ImmutableList.builder();
        for (ResourceType type : types) {
            Status status = Documents.createTableIfMissing(dbConnection, type);
            if (status.isError()) {
                Logger.error("Failed to create table {}: {}", type.tableName(), status.getMessage());
                return InitResult.error(ensured.build(), status.getMessage());
            }
            Logger.info("Table {} is ready", type.tableName());
            ensured.add(type.tableName());
        }
        return InitResult.success(ensured.build());
    }

    /**
     * Borrows a connection from {@code dataSource} and runs the operation with it.
     */
    public static InitResult run(DataSource dataSource, Collection<ResourceType> types) {
        try (Connection conn = dataSource.getConnection()) {
            return new SchemaInitOperation(conn, types).execute();
        } catch (SQLException e) {
            Logger.error(e, "Could not connect to initialize the schema");
            return InitResult.error(List.of(), "Connection failed: " + e.getMessage());
        }
    }
}
