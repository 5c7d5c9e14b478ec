package com.docstore;

import com.docstore.config.BuildInfo;
import com.docstore.config.DatabaseConfig;
import com.docstore.config.HttpConfig;
import com.docstore.config.ServiceConfig;
import com.docstore.operations.SchemaInitOperation;
import com.docstore.rest.GsonJsonMapper;
import com.docstore.rest.RestAdapterFactory;
import com.docstore.routing.ResourceRouter;
import com.docstore.store.JdbcDocumentStore;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.javalin.Javalin;
import java.util.Map;
import org.eclipse.jetty.http.UriCompliance;
import org.tinylog.Logger;
import org.tinylog.configuration.Configuration;

/**
 * Entry point of the document service.
 *
 * <p>Startup reads every setting from the environment, opens the log file, builds the connection
 * pool, ensures the document tables exist and starts the REST server. The resulting {@link
 * AppContext} is the only state shared between requests.
 *
 * <h2>Error Handling</h2>
 *
 * <ul>
 *   <li>Malformed resource paths and request bodies return 400 Bad Request
 *   <li>Unknown identifiers return 404 Not Found
 *   <li>Database failures and unexpected exceptions return 500 Internal Server Error
 * </ul>
 */
public class Main {

  private final HttpConfig httpConfig;
  private final ServiceConfig serviceConfig;
  private final HikariDataSource dataSource;
  private final AppContext context;
  private Javalin app;

  public Main(DatabaseConfig databaseConfig, HttpConfig httpConfig, ServiceConfig serviceConfig) {
    this.httpConfig = httpConfig;
    this.serviceConfig = serviceConfig;
    this.dataSource = setupDataSource(databaseConfig);

    ResourceRouter router =
        ResourceRouter.of(serviceConfig.resourceTypes(), serviceConfig.defaultNamespace());
    Logger.info("Serving {}", router);

    if (databaseConfig.initSchema()) {
      SchemaInitOperation.InitResult result = SchemaInitOperation.run(dataSource, router.types());
      if (!result.isSuccess()) {
        dataSource.close();
        throw new IllegalStateException("Schema initialization failed: " + result.errorMessage());
      }
    }

    this.context = new AppContext(new JdbcDocumentStore(dataSource), router);
  }

  /**
   * Sets up the HikariCP connection pool. Every pooled connection carries a server-side statement
   * timeout so a stuck statement is cancelled by the database rather than holding a request.
   *
   * @return A configured HikariDataSource for database connections
   */
  private static HikariDataSource setupDataSource(DatabaseConfig databaseConfig) {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl(databaseConfig.jdbcUrl());
    config.setUsername(databaseConfig.username());
    config.setPassword(databaseConfig.password());
    config.setMaximumPoolSize(databaseConfig.maxPoolSize());
    config.setMinimumIdle(Math.min(2, databaseConfig.maxPoolSize()));
    config.setIdleTimeout(30000);
    config.setMaxLifetime(1800000);
    config.setConnectionTimeout(30000);
    config.setAutoCommit(true);
    config.setPoolName("DocumentStorePool");
    config.setConnectionInitSql(
        "SET statement_timeout = " + databaseConfig.statementTimeout().toMillis());
    config.addDataSourceProperty("cachePrepStmts", "true");
    config.addDataSourceProperty("prepStmtCacheSize", "250");
    config.addDataSourceProperty("prepStmtCacheSqlLimit", "2048");

    Logger.info("Initializing database connection pool: {}", databaseConfig.toSecureString());
    return new HikariDataSource(config);
  }

  /**
   * Builds the Javalin application for a context without starting it.
   *
   * @param context shared store and route table
   * @param httpConfig listener address and timeouts
   * @param serviceConfig API behaviour settings
   * @param buildInfo version details for the version endpoint
   */
  static Javalin createApp(
      AppContext context, HttpConfig httpConfig, ServiceConfig serviceConfig, BuildInfo buildInfo) {
    RestAdapterFactory restAdapterFactory =
        new RestAdapterFactory(context, serviceConfig.putPolicy(), buildInfo);

    Javalin javalin =
        Javalin.create(
            config -> {
              config.showJavalinBanner = false;
              config.jsonMapper(new GsonJsonMapper());
              config.jetty.defaultHost = httpConfig.host();
              config.jetty.defaultPort = httpConfig.port();
              config.jetty.modifyHttpConfiguration(
                  httpConfiguration -> {
                    httpConfiguration.setIdleTimeout(httpConfig.idleTimeout().toMillis());
                    // An empty namespace segment ("/namespace//films/...") selects the default
                    // namespace; Jetty's default compliance rejects empty segments.
                    httpConfiguration.setUriCompliance(UriCompliance.LEGACY);
                  });
              config.jetty.modifyServer(
                  server -> server.setStopTimeout(httpConfig.shutdownTimeout().toMillis()));
              restAdapterFactory.configureRoutes(config.router);
            });
    restAdapterFactory.configureExceptionHandling(javalin);
    return javalin;
  }

  public void start() {
    app = createApp(context, httpConfig, serviceConfig, BuildInfo.load());
    app.start();
    Logger.info("REST server started, listening on {}:{}.", httpConfig.host(), app.port());

    Runtime.getRuntime()
        .addShutdownHook(
            new Thread(
                () -> {
                  Logger.info("Shutting down server since JVM is shutting down");
                  try {
                    stop();
                  } catch (Exception e) {
                    Logger.error(e, "Error during shutdown.");
                  }
                }));
  }

  public void stop() {
    if (app != null) {
      app.stop();
    }
    if (!dataSource.isClosed()) {
      Logger.info("Shutting down database connection pool");
      dataSource.close();
    }
  }

  public static void main(String[] args) {
    Map<String, String> env = System.getenv();
    HttpConfig httpConfig = HttpConfig.fromEnvironment(env);

    // Must run before the first log statement freezes the tinylog configuration.
    Configuration.set("writerFile.file", httpConfig.logPath());
    Logger.info("Logfile opened {}", httpConfig.logPath());

    Main server =
        new Main(
            DatabaseConfig.fromEnvironment(env), httpConfig, ServiceConfig.fromEnvironment(env));
    server.start();
  }
}
