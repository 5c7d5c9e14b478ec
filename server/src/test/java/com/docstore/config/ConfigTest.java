package com.docstore.config;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ConfigTest {

  @Test
  void testDatabaseDefaults() {
    DatabaseConfig config = DatabaseConfig.fromEnvironment(Map.of());

    assertEquals("root", config.username());
    assertEquals("", config.password());
    assertEquals("pavedroad", config.database());
    assertEquals(26257, config.port());
    assertEquals(Duration.ofSeconds(30), config.statementTimeout());
    assertTrue(config.initSchema());
    assertEquals(
        "jdbc:postgresql://127.0.0.1:26257/pavedroad?sslmode=disable&ApplicationName=docstore",
        config.jdbcUrl());
  }

  @Test
  void testDatabaseOverrides() {
    DatabaseConfig config =
        DatabaseConfig.fromEnvironment(
            Map.of(
                DatabaseConfig.HOST, "db.internal",
                DatabaseConfig.PORT, "5432",
                DatabaseConfig.DATABASE, "acme",
                DatabaseConfig.SSL_MODE, "require",
                DatabaseConfig.PASSWORD, "s3cret",
                DatabaseConfig.INIT_SCHEMA, "false"));

    assertEquals("jdbc:postgresql://db.internal:5432/acme?sslmode=require&ApplicationName=docstore",
        config.jdbcUrl());
    assertFalse(config.initSchema());
    assertFalse(config.toSecureString().contains("s3cret"));
  }

  @Test
  void testInvalidValuesFailFast() {
    assertThrows(
        IllegalArgumentException.class,
        () -> DatabaseConfig.fromEnvironment(Map.of(DatabaseConfig.PORT, "not-a-port")));
    assertThrows(
        IllegalArgumentException.class,
        () -> DatabaseConfig.fromEnvironment(Map.of(DatabaseConfig.INIT_SCHEMA, "maybe")));
    assertThrows(
        IllegalArgumentException.class,
        () -> HttpConfig.fromEnvironment(Map.of(HttpConfig.READ_TIMEOUT, "-5")));
    assertThrows(
        IllegalArgumentException.class,
        () -> ServiceConfig.fromEnvironment(Map.of(ServiceConfig.PUT_POLICY, "sometimes")));
  }

  @Test
  void testHttpDefaults() {
    HttpConfig config = HttpConfig.fromEnvironment(Map.of());

    assertEquals("127.0.0.1", config.host());
    assertEquals(8082, config.port());
    assertEquals(Duration.ofSeconds(15), config.shutdownTimeout());
    assertEquals("logs/documents.log", config.logPath());
  }

  @Test
  void testHttpPortZeroSelectsEphemeralPort() {
    assertEquals(0, HttpConfig.fromEnvironment(Map.of(HttpConfig.PORT, "0")).port());
    assertThrows(
        IllegalArgumentException.class,
        () -> HttpConfig.fromEnvironment(Map.of(HttpConfig.PORT, "65536")));
    assertThrows(
        IllegalArgumentException.class,
        () -> DatabaseConfig.fromEnvironment(Map.of(DatabaseConfig.PORT, "0")));
  }

  @Test
  void testBooleansIgnoreDefaultLocale() {
    Locale original = Locale.getDefault();
    Locale.setDefault(new Locale("tr", "TR"));
    try {
      assertFalse(
          DatabaseConfig.fromEnvironment(Map.of(DatabaseConfig.INIT_SCHEMA, "FALSE")).initSchema());
      assertTrue(
          DatabaseConfig.fromEnvironment(Map.of(DatabaseConfig.INIT_SCHEMA, "True")).initSchema());
    } finally {
      Locale.setDefault(original);
    }
  }

  @Test
  void testIdleTimeoutIsTheLargerBound() {
    HttpConfig config =
        HttpConfig.fromEnvironment(
            Map.of(HttpConfig.READ_TIMEOUT, "10", HttpConfig.WRITE_TIMEOUT, "45"));

    assertEquals(Duration.ofSeconds(45), config.idleTimeout());
  }

  @Test
  void testServiceConfig() {
    ServiceConfig defaults = ServiceConfig.fromEnvironment(Map.of());
    assertEquals(List.of("films"), defaults.resourceTypes());
    assertEquals("pavedroad.io", defaults.defaultNamespace());
    assertEquals(PutPolicy.REJECT_UNKNOWN, defaults.putPolicy());

    ServiceConfig custom =
        ServiceConfig.fromEnvironment(
            Map.of(
                ServiceConfig.RESOURCE_TYPES, " films, books ,,",
                ServiceConfig.PUT_POLICY, "create_unknown"));
    assertEquals(List.of("films", "books"), custom.resourceTypes());
    assertEquals(PutPolicy.CREATE_UNKNOWN, custom.putPolicy());
  }
}
