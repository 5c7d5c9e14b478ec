package com.docstore.db;

import static org.junit.jupiter.api.Assertions.*;

import com.docstore.common.status.Status;
import com.docstore.common.status.StatusCode;
import com.docstore.common.status.StatusOr;
import com.docstore.db.util.PostgresTestHelper;
import com.docstore.db.util.PostgresTestHelper.PostgresContext;
import com.docstore.routing.ResourceType;
import com.google.gson.JsonParser;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Tests for the Documents helper class against a real PostgreSQL. These tests verify every
 * statement the store issues, including the empty-body reservation row.
 */
@Testcontainers(disabledWithoutDocker = true)
public class DocumentsTest {

  private static final ResourceType FILMS = ResourceType.of("films");
  private static final String ALIEN = "{\"title\": \"Alien\", \"year\": 1979}";

  private static PostgresContext postgresContext;
  private static Connection connection;

  @BeforeAll
  static void setUp() throws SQLException {
    postgresContext = PostgresTestHelper.setupPostgres("docstore_documents_test");
    connection = postgresContext.getConnection();
  }

  @AfterAll
  static void tearDown() {
    if (postgresContext != null) {
      postgresContext.close();
    }
  }

  @BeforeEach
  void clearData() throws SQLException {
    try (var stmt = connection.createStatement()) {
      stmt.execute("DELETE FROM films");
    }
  }

  @Test
  void testReserve_CreatesRowWithoutBody() {
    StatusOr<UUID> result = Documents.reserve(connection, FILMS);

    assertTrue(result.isOk());
    Optional<Document> loaded = Documents.loadById(connection, FILMS, result.getValue()).getValue();
    assertTrue(loaded.isPresent());
    assertTrue(loaded.get().writtenBody().isEmpty());
  }

  @Test
  void testReserve_GeneratesDistinctIdentifiers() {
    UUID first = Documents.reserve(connection, FILMS).getValue();
    UUID second = Documents.reserve(connection, FILMS).getValue();

    assertNotEquals(first, second);
  }

  @Test
  void testInsertThenLoad_BodyIsStructurallyEqual() {
    UUID id = Documents.insert(connection, FILMS, ALIEN).getValue();

    Document document = Documents.loadById(connection, FILMS, id).getValue().orElseThrow();

    // JSONB normalizes whitespace and key order, so compare parsed trees.
    assertEquals(id, document.identifier());
    assertEquals(
        JsonParser.parseString(ALIEN), JsonParser.parseString(document.writtenBody().orElseThrow()));
  }

  @Test
  void testLoadById_ReturnsEmpty_WhenRowDoesNotExist() {
    StatusOr<Optional<Document>> result = Documents.loadById(connection, FILMS, UUID.randomUUID());

    assertTrue(result.isOk());
    assertFalse(result.getValue().isPresent());
  }

  @Test
  void testUpdateBody_ReportsAffectedRows() {
    UUID id = Documents.reserve(connection, FILMS).getValue();

    assertEquals(1, Documents.updateBody(connection, FILMS, id, ALIEN).getValue());
    assertEquals(0, Documents.updateBody(connection, FILMS, UUID.randomUUID(), ALIEN).getValue());
  }

  @Test
  void testSave_InsertsThenOverwrites() {
    UUID id = UUID.randomUUID();

    assertTrue(Documents.save(connection, FILMS, id, ALIEN).isOk());
    assertTrue(Documents.save(connection, FILMS, id, "{\"title\": \"Aliens\"}").isOk());

    String body = Documents.loadById(connection, FILMS, id).getValue().orElseThrow().body();
    assertEquals("Aliens", JsonParser.parseString(body).getAsJsonObject().get("title").getAsString());
  }

  @Test
  void testDelete_ReportsAffectedRows() {
    UUID id = Documents.insert(connection, FILMS, ALIEN).getValue();

    assertEquals(1, Documents.delete(connection, FILMS, id).getValue());
    assertEquals(0, Documents.delete(connection, FILMS, id).getValue());
  }

  @Test
  void testInvalidJson_IsRejectedByTheDatabase() {
    UUID id = Documents.reserve(connection, FILMS).getValue();

    StatusOr<Integer> result = Documents.updateBody(connection, FILMS, id, "{not json");

    assertTrue(result.isNotOk());
    assertEquals(StatusCode.INVALID_BODY, result.getStatus().getCode());
  }

  @Test
  void testJsonThatJsonbCannotHold_IsInvalidBody() {
    StatusOr<UUID> nul = Documents.insert(connection, FILMS, "{\"a\":\"\\u0000\"}");
    StatusOr<UUID> surrogate = Documents.insert(connection, FILMS, "{\"a\":\"\\ud800\"}");

    assertEquals(StatusCode.INVALID_BODY, nul.getStatus().getCode());
    assertEquals(StatusCode.INVALID_BODY, surrogate.getStatus().getCode());
  }

  @Test
  void testCreateTableIfMissing_IsIdempotentAndBuildsGinIndex() throws SQLException {
    ResourceType books = ResourceType.of("books");

    Status first = Documents.createTableIfMissing(connection, books);
    Status second = Documents.createTableIfMissing(connection, books);

    assertTrue(first.isOk());
    assertTrue(second.isOk());
    try (var stmt =
            connection.prepareStatement("SELECT indexdef FROM pg_indexes WHERE indexname = ?")) {
      stmt.setString(1, books.bodyIndexName());
      try (ResultSet rs = stmt.executeQuery()) {
        assertTrue(rs.next());
        assertTrue(rs.getString(1).toLowerCase().contains("using gin"));
      }
    }
  }
}
