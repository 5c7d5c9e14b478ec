package com.docstore.config;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.primitives.Ints;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/** Typed lookups over an environment map, falling back to defaults for absent values. */
final class EnvValues {

  private final Map<String, String> env;

  EnvValues(Map<String, String> env) {
    this.env = env;
  }

  String string(String name, String defaultValue) {
    String value = env.get(name);
    return Strings.isNullOrEmpty(value) ? defaultValue : value.trim();
  }

  int positiveInt(String name, int defaultValue) {
    String raw = env.get(name);
    if (Strings.isNullOrEmpty(raw)) {
      return defaultValue;
    }
    Integer parsed = Ints.tryParse(raw.trim());
    Preconditions.checkArgument(
        parsed != null && parsed > 0, "%s must be a positive integer, got '%s'", name, raw);
    return parsed;
  }

  /** Reads a TCP port; 0 is accepted and asks the operating system for an ephemeral port. */
  int port(String name, int defaultValue) {
    String raw = env.get(name);
    if (Strings.isNullOrEmpty(raw)) {
      return defaultValue;
    }
    Integer parsed = Ints.tryParse(raw.trim());
    Preconditions.checkArgument(
        parsed != null && parsed >= 0 && parsed <= 65535,
        "%s must be a port between 0 and 65535, got '%s'",
        name,
        raw);
    return parsed;
  }

  /** Reads a whole number of seconds, the unit every timeout variable is expressed in. */
  Duration seconds(String name, int defaultSeconds) {
    return Duration.ofSeconds(positiveInt(name, defaultSeconds));
  }

  boolean bool(String name, boolean defaultValue) {
    String raw = env.get(name);
    if (Strings.isNullOrEmpty(raw)) {
      return defaultValue;
    }
    String value = raw.trim().toLowerCase(Locale.ROOT);
    Preconditions.checkArgument(
        value.equals("true") || value.equals("false"),
        "%s must be true or false, got '%s'",
        name,
        raw);
    return Boolean.parseBoolean(value);
  }
}
