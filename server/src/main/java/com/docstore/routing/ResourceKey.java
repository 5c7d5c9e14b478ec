package com.docstore.routing;

/**
 * The last part of a resource address: either a concrete identifier or a request to allocate one.
 *
 * <p>The {@code LIST} sentinel is turned into an {@link AllocateKey} by {@link ResourceRouter}, so
 * nothing past the router ever inspects the raw path segment.
 */
public interface ResourceKey {

  /** Returns true for the allocate sentinel. */
  boolean isAllocate();
}
