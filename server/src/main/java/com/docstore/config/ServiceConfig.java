package com.docstore.config;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Settings that shape the resource API rather than its transport.
 *
 * @param resourceTypes names of the document types served, one table each
 * @param defaultNamespace namespace used when a request leaves the namespace value empty
 * @param putPolicy behaviour of PUT against an identifier with no row
 */
public record ServiceConfig(
    List<String> resourceTypes, String defaultNamespace, PutPolicy putPolicy) {

  public static final String RESOURCE_TYPES = "APP_RESOURCE_TYPES";
  public static final String DEFAULT_NAMESPACE = "APP_DEFAULT_NAMESPACE";
  public static final String PUT_POLICY = "APP_PUT_POLICY";

  public ServiceConfig {
    Preconditions.checkArgument(!resourceTypes.isEmpty(), "at least one resource type is required");
    resourceTypes = ImmutableList.copyOf(resourceTypes);
  }

  public static ServiceConfig fromEnvironment(Map<String, String> environment) {
    EnvValues env = new EnvValues(environment);
    List<String> types =
        Splitter.on(',')
            .trimResults()
            .omitEmptyStrings()
            .splitToList(env.string(RESOURCE_TYPES, "films"));
    String policy = env.string(PUT_POLICY, PutPolicy.REJECT_UNKNOWN.name());
    PutPolicy putPolicy;
    try {
      putPolicy = PutPolicy.valueOf(policy.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(
          PUT_POLICY + " must be one of REJECT_UNKNOWN, CREATE_UNKNOWN, got '" + policy + "'", e);
    }
    return new ServiceConfig(types, env.string(DEFAULT_NAMESPACE, "pavedroad.io"), putPolicy);
  }
}
