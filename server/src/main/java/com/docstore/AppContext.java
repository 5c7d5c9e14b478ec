package com.docstore;

import com.docstore.routing.ResourceRouter;
import com.docstore.store.DocumentStore;
import java.util.Objects;

/**
 * The state shared by all request handlers: one store over the connection pool and one route
 * table. Built once during startup and never modified; request data travels only through handler
 * parameters.
 *
 * @param store the document store
 * @param router the resource route table
 */
public record AppContext(DocumentStore store, ResourceRouter router) {

  public AppContext {
    Objects.requireNonNull(store, "store");
    Objects.requireNonNull(router, "router");
  }
}
