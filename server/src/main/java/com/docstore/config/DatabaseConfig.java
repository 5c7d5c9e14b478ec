package com.docstore.config;

import com.google.common.base.MoreObjects;
import java.time.Duration;
import java.util.Map;

/**
 * Connection settings for the relational store.
 *
 * <p>The defaults target a local single-node CockroachDB, which speaks the PostgreSQL wire
 * protocol; any PostgreSQL 13+ server works as well.
 *
 * @param username database login
 * @param password database password, never logged
 * @param database database name
 * @param sslMode value passed to the driver's {@code sslmode} parameter
 * @param host database host
 * @param port database port
 * @param statementTimeout server-side bound on every statement
 * @param maxPoolSize upper bound on pooled connections
 * @param initSchema whether to create missing document tables at startup
 */
public record DatabaseConfig(
    String username,
    String password,
    String database,
    String sslMode,
    String host,
    int port,
    Duration statementTimeout,
    int maxPoolSize,
    boolean initSchema) {

  public static final String USERNAME = "APP_DB_USERNAME";
  public static final String PASSWORD = "APP_DB_PASSWORD";
  public static final String DATABASE = "APP_DB_NAME";
  public static final String SSL_MODE = "APP_DB_SSL_MODE";
  public static final String HOST = "APP_DB_IP";
  public static final String PORT = "APP_DB_PORT";
  public static final String STATEMENT_TIMEOUT = "APP_DB_STATEMENT_TIMEOUT";
  public static final String POOL_SIZE = "APP_DB_POOL_SIZE";
  public static final String INIT_SCHEMA = "APP_DB_INIT_SCHEMA";

  /** Reads the database settings from an environment map. */
  public static DatabaseConfig fromEnvironment(Map<String, String> environment) {
    EnvValues env = new EnvValues(environment);
    return new DatabaseConfig(
        env.string(USERNAME, "root"),
        env.string(PASSWORD, ""),
        env.string(DATABASE, "pavedroad"),
        env.string(SSL_MODE, "disable"),
        env.string(HOST, "127.0.0.1"),
        env.positiveInt(PORT, 26257),
        env.seconds(STATEMENT_TIMEOUT, 30),
        env.positiveInt(POOL_SIZE, 10),
        env.bool(INIT_SCHEMA, true));
  }

  /** Builds the PostgreSQL JDBC URL for these settings. */
  public String jdbcUrl() {
    return "jdbc:postgresql://"
        + host
        + ":"
        + port
        + "/"
        + database
        + "?sslmode="
        + sslMode
        + "&ApplicationName=docstore";
  }

  /** Returns a description of this configuration that is safe to log. */
  public String toSecureString() {
    return MoreObjects.toStringHelper(this)
        .add("url", jdbcUrl())
        .add("username", username)
        .add("statementTimeout", statementTimeout)
        .add("maxPoolSize", maxPoolSize)
        .add("initSchema", initSchema)
        .toString();
  }
}
