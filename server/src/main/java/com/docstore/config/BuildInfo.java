package com.docstore.config;

import com.google.common.io.Resources;
import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.Properties;
import org.tinylog.Logger;

/**
 * Version and build identifiers stamped into {@code version.properties} at package time.
 *
 * @param version the release version
 * @param build the short source revision, or {@code dev} for local builds
 */
public record BuildInfo(String version, String build) {

  private static final String RESOURCE = "version.properties";
  private static final BuildInfo UNKNOWN = new BuildInfo("unknown", "unknown");

  /** Loads the build identifiers from the classpath, or returns "unknown" values if absent. */
  public static BuildInfo load() {
    URL url;
    try {
      url = Resources.getResource(RESOURCE);
    } catch (IllegalArgumentException e) {
      Logger.warn("{} not found on the classpath", RESOURCE);
      return UNKNOWN;
    }
    Properties properties = new Properties();
    try (InputStream in = Resources.asByteSource(url).openStream()) {
      properties.load(in);
    } catch (IOException e) {
      Logger.warn(e, "Could not read {}", RESOURCE);
      return UNKNOWN;
    }
    return new BuildInfo(
        properties.getProperty("version", UNKNOWN.version()),
        properties.getProperty("build", UNKNOWN.build()));
  }
}
