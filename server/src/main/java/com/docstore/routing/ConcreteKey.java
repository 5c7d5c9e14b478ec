package com.docstore.routing;

import java.util.Objects;
import java.util.UUID;

/** A key naming one stored document. */
public record ConcreteKey(UUID identifier) implements ResourceKey {

  public ConcreteKey {
    Objects.requireNonNull(identifier, "identifier");
  }

  @Override
  public boolean isAllocate() {
    return false;
  }
}
