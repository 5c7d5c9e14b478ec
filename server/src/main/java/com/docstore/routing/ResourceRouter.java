package com.docstore.routing;

import com.docstore.common.status.Status;
import com.docstore.common.status.StatusOr;
import com.docstore.db.util.UuidUtil;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import javax.annotation.Nonnull;

/**
 * Route table and codec for resource paths.
 *
 * <p>Accepted shapes, each with an optional trailing slash:
 *
 * <pre>
 * /api/v1/namespace/{namespace}/{type}LIST        allocate
 * /api/v1/namespace/{namespace}/{type}/LIST       allocate
 * /api/v1/namespace/{namespace}/{type}/{uuid}     concrete document
 * </pre>
 *
 * <p>An empty namespace value resolves to the configured default. Everything else that does not
 * fit, including an unregistered type, yields an {@code INVALID_ADDRESS} status. Instances are
 * immutable and shared by all request threads.
 */
public final class ResourceRouter {

  public static final String API_VERSION = "/api/v1";
  public static final String NAMESPACE_SEGMENT = "namespace";
  public static final String SENTINEL = "LIST";

  private static final Splitter PATH_SPLITTER = Splitter.on('/');

  private final ImmutableMap<String, ResourceType> types;
  private final String defaultNamespace;

  public ResourceRouter(Collection<ResourceType> types, String defaultNamespace) {
    Preconditions.checkArgument(!types.isEmpty(), "at least one resource type is required");
    Preconditions.checkArgument(
        defaultNamespace != null && !defaultNamespace.isBlank(),
        "default namespace must not be blank");
    ImmutableMap.Builder<String, ResourceType> builder = ImmutableMap.builder();
    for (ResourceType type : types) {
      builder.put(type.name(), type);
    }
    this.types = builder.buildOrThrow();
    this.defaultNamespace = defaultNamespace;
  }

  /** Builds a router from configured type names. */
  public static ResourceRouter of(List<String> typeNames, String defaultNamespace) {
    return new ResourceRouter(
        typeNames.stream().map(ResourceType::of).collect(ImmutableList.toImmutableList()),
        defaultNamespace);
  }

  /** Returns every registered resource type. */
  public Collection<ResourceType> types() {
    return types.values();
  }

  public String defaultNamespace() {
    return defaultNamespace;
  }

  /** Looks up a registered type, ignoring case. */
  public Optional<ResourceType> findType(String name) {
    return Optional.ofNullable(types.get(name.toLowerCase(Locale.ROOT)));
  }

  /**
   * Parses a request path into an address.
   *
   * @param path the request path, starting with {@link #API_VERSION}
   * @return the address, or an {@code INVALID_ADDRESS} status describing what is wrong
   */
  @Nonnull
  public StatusOr<ResourceAddress> resolve(String path) {
    if (path == null || !path.startsWith(API_VERSION + "/")) {
      return invalid("Path must start with " + API_VERSION + "/: " + path);
    }
    String rest = path.substring(API_VERSION.length() + 1);
    if (rest.endsWith("/")) {
      rest = rest.substring(0, rest.length() - 1);
    }
    List<String> segments = PATH_SPLITTER.splitToList(rest);
    if (segments.size() < 3 || segments.size() > 4) {
      return invalid("Expected namespace/{namespace}/{type}/{key}, got: " + path);
    }
    if (!NAMESPACE_SEGMENT.equals(segments.get(0))) {
      return invalid("Missing '" + NAMESPACE_SEGMENT + "' segment in: " + path);
    }
    String namespace = segments.get(1).isEmpty() ? defaultNamespace : segments.get(1);

    if (segments.size() == 3) {
      String typeSegment = segments.get(2);
      if (!typeSegment.endsWith(SENTINEL) || typeSegment.length() == SENTINEL.length()) {
        return invalid("Missing key in: " + path);
      }
      String typeName = typeSegment.substring(0, typeSegment.length() - SENTINEL.length());
      return lookupType(typeName)
          .map(type -> new ResourceAddress(namespace, type, AllocateKey.INSTANCE));
    }

    StatusOr<ResourceType> typeOr = lookupType(segments.get(2));
    if (typeOr.isNotOk()) {
      return StatusOr.ofStatus(typeOr.getStatus());
    }
    String keySegment = segments.get(3);
    if (SENTINEL.equals(keySegment)) {
      return StatusOr.ofValue(
          new ResourceAddress(namespace, typeOr.getValue(), AllocateKey.INSTANCE));
    }
    StatusOr<UUID> idOr = UuidUtil.fromString(keySegment);
    if (idOr.isNotOk()) {
      return invalid(idOr.getStatus().getMessage());
    }
    return StatusOr.ofValue(
        new ResourceAddress(namespace, typeOr.getValue(), new ConcreteKey(idOr.getValue())));
  }

  /**
   * Renders the canonical path of an address. Allocate keys use the suffix form
   * {@code {type}LIST/}.
   */
  @Nonnull
  public String pathFor(ResourceAddress address) {
    String base =
        API_VERSION + "/" + NAMESPACE_SEGMENT + "/" + address.namespace() + "/"
            + address.type().name();
    if (address.key() instanceof ConcreteKey concrete) {
      return base + "/" + concrete.identifier();
    }
    return base + SENTINEL + "/";
  }

  private StatusOr<ResourceType> lookupType(String name) {
    if (name.isEmpty()) {
      return invalid("Missing resource type");
    }
    return findType(name)
        .map(StatusOr::ofValue)
        .orElseGet(() -> invalid("Unknown resource type: " + name));
  }

  private static <T> StatusOr<T> invalid(String message) {
    return StatusOr.ofStatus(Status.invalidAddress(message));
  }

  @Override
  public String toString() {
    return "ResourceRouter{types=" + types.keySet() + ", defaultNamespace=" + defaultNamespace + "}";
  }
}
