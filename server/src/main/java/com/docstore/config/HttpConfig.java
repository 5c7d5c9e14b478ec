package com.docstore.config;

import java.time.Duration;
import java.util.Map;

/**
 * Listener settings for the REST server.
 *
 * @param host address to bind
 * @param port port to bind, 0 for an ephemeral port
 * @param readTimeout idle bound while reading a request
 * @param writeTimeout idle bound while writing a response
 * @param shutdownTimeout how long in-flight requests may run once a stop is requested
 * @param logPath file the log writer appends to
 */
public record HttpConfig(
    String host,
    int port,
    Duration readTimeout,
    Duration writeTimeout,
    Duration shutdownTimeout,
    String logPath) {

  public static final String HOST = "HTTP_IP_ADDR";
  public static final String PORT = "HTTP_IP_PORT";
  public static final String READ_TIMEOUT = "HTTP_READ_TIMEOUT";
  public static final String WRITE_TIMEOUT = "HTTP_WRITE_TIMEOUT";
  public static final String SHUTDOWN_TIMEOUT = "HTTP_SHUTDOWN_TIMEOUT";
  public static final String LOG_PATH = "HTTP_LOG";

  public static HttpConfig fromEnvironment(Map<String, String> environment) {
    EnvValues env = new EnvValues(environment);
    return new HttpConfig(
        env.string(HOST, "127.0.0.1"),
        env.port(PORT, 8082),
        env.seconds(READ_TIMEOUT, 60),
        env.seconds(WRITE_TIMEOUT, 60),
        env.seconds(SHUTDOWN_TIMEOUT, 15),
        env.string(LOG_PATH, "logs/documents.log"));
  }

  /**
   * Jetty has a single idle timeout per connection covering both directions, so the larger of the
   * two bounds is applied.
   */
  public Duration idleTimeout() {
    return readTimeout.compareTo(writeTimeout) >= 0 ? readTimeout : writeTimeout;
  }
}
