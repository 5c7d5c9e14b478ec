package com.docstore.routing;

/** The {@code LIST} sentinel: no identifier yet, the store should allocate one. */
public record AllocateKey() implements ResourceKey {

  public static final AllocateKey INSTANCE = new AllocateKey();

  @Override
  public boolean isAllocate() {
    return true;
  }
}
