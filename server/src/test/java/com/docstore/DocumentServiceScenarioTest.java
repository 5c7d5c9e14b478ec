package com.docstore;

import static org.junit.jupiter.api.Assertions.*;

import com.docstore.config.BuildInfo;
import com.docstore.config.HttpConfig;
import com.docstore.config.PutPolicy;
import com.docstore.config.ServiceConfig;
import com.docstore.routing.ResourceRouter;
import com.docstore.store.InMemoryDocumentStore;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import io.javalin.Javalin;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Drives the full HTTP stack (routing, handlers, JSON mapping and error responses) over a real
 * socket, with the database replaced by the in-memory store.
 */
class DocumentServiceScenarioTest {

  private static final String FILMS = "/api/v1/namespace/pavedroad.io/films";
  private static final String FILM = "{\"title\":\"The Thing\",\"year\":1982,\"director\":\"John Carpenter\"}";

  private final HttpClient client = HttpClient.newHttpClient();
  private InMemoryDocumentStore store;
  private Javalin app;
  private String baseUrl;

  @BeforeEach
  void setUp() {
    store = new InMemoryDocumentStore();
    ServiceConfig serviceConfig =
        new ServiceConfig(List.of("films"), "pavedroad.io", PutPolicy.REJECT_UNKNOWN);
    HttpConfig httpConfig =
        new HttpConfig(
            "127.0.0.1",
            0,
            Duration.ofSeconds(5),
            Duration.ofSeconds(5),
            Duration.ofSeconds(1),
            "logs/test.log");
    AppContext context =
        new AppContext(
            store,
            ResourceRouter.of(serviceConfig.resourceTypes(), serviceConfig.defaultNamespace()));

    app = Main.createApp(context, httpConfig, serviceConfig, new BuildInfo("test", "local"));
    app.start();
    baseUrl = "http://127.0.0.1:" + app.port();
  }

  @AfterEach
  void tearDown() {
    if (app != null) {
      app.stop();
    }
  }

  @Test
  void testFilmsLifecycle() throws Exception {
    HttpResponse<String> allocated = send("GET", FILMS + "LIST/", null);
    assertEquals(200, allocated.statusCode());
    String id = JsonParser.parseString(allocated.body()).getAsJsonObject().get("identifier").getAsString();

    HttpResponse<String> put = send("PUT", FILMS + "/" + id, FILM);
    assertEquals(200, put.statusCode());
    assertEquals(id, JsonParser.parseString(put.body()).getAsJsonObject().get("identifier").getAsString());

    HttpResponse<String> read = send("GET", FILMS + "/" + id, null);
    assertEquals(200, read.statusCode());
    assertEquals(JsonParser.parseString(FILM), JsonParser.parseString(read.body()));
    assertTrue(read.headers().firstValue("Content-Type").orElse("").startsWith("application/json"));

    assertEquals(204, send("DELETE", FILMS + "/" + id, null).statusCode());
    assertEquals(404, send("GET", FILMS + "/" + id, null).statusCode());
  }

  @Test
  void testPostCreatesDocument() throws Exception {
    HttpResponse<String> created = send("POST", FILMS + "/LIST", FILM);

    assertEquals(201, created.statusCode());
    String location = created.headers().firstValue("Location").orElseThrow();
    assertEquals(200, send("GET", location, null).statusCode());
  }

  @Test
  void testErrorsAreJson() throws Exception {
    HttpResponse<String> badPath = send("GET", FILMS + "/not-a-uuid", null);
    assertEquals(400, badPath.statusCode());
    JsonObject error = JsonParser.parseString(badPath.body()).getAsJsonObject();
    assertTrue(error.has("error"));

    String id = JsonParser.parseString(send("GET", FILMS + "LIST", null).body())
        .getAsJsonObject().get("identifier").getAsString();
    assertEquals(400, send("PUT", FILMS + "/" + id, "{\"title\":").statusCode());
    assertEquals(400, send("DELETE", FILMS + "LIST", null).statusCode());
    assertEquals(400, send("GET", "/api/v1/namespace/pavedroad.io/songsLIST", null).statusCode());
  }

  @Test
  void testManagementEndpoints() throws Exception {
    assertEquals(200, send("GET", "/api/v1/management/liveness", null).statusCode());
    assertEquals(200, send("GET", "/api/v1/management/readiness", null).statusCode());

    HttpResponse<String> version = send("GET", "/api/v1/management/version", null);
    assertEquals("test", JsonParser.parseString(version.body()).getAsJsonObject().get("version").getAsString());

    store.setReady(false);
    assertEquals(503, send("GET", "/api/v1/management/readiness", null).statusCode());
  }

  private HttpResponse<String> send(String method, String path, String body)
      throws IOException, InterruptedException {
    HttpRequest.BodyPublisher publisher =
        body == null
            ? HttpRequest.BodyPublishers.noBody()
            : HttpRequest.BodyPublishers.ofString(body);
    HttpRequest request =
        HttpRequest.newBuilder(URI.create(baseUrl + path))
            .method(method, publisher)
            .header("Content-Type", "application/json")
            .build();
    return client.send(request, HttpResponse.BodyHandlers.ofString());
  }
}
