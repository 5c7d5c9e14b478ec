package com.docstore.routing;

import java.util.Objects;

/**
 * A parsed request path.
 *
 * @param namespace logical grouping; routing only, never stored
 * @param type the document category, which selects the table
 * @param key the document key or the allocate sentinel
 */
public record ResourceAddress(String namespace, ResourceType type, ResourceKey key) {

  public ResourceAddress {
    Objects.requireNonNull(namespace, "namespace");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(key, "key");
  }

  /** Returns a copy of this address pointing at the given identifier. */
  public ResourceAddress withKey(ResourceKey newKey) {
    return new ResourceAddress(namespace, type, newKey);
  }

  @Override
  public String toString() {
    String keyText =
        key instanceof ConcreteKey concrete ? concrete.identifier().toString() : "LIST";
    return namespace + "/" + type.name() + "/" + keyText;
  }
}
