package com.docstore.rest;

import com.docstore.config.BuildInfo;
import com.docstore.rest.dto.HealthResponse;
import com.docstore.rest.dto.VersionResponse;
import com.docstore.store.DocumentStore;
import io.javalin.http.Context;
import org.tinylog.Logger;

/** REST adapter for the orchestration probes and build information. */
public class ManagementRestAdapter implements RestAdapter {

  private final DocumentStore store;
  private final BuildInfo buildInfo;

  public ManagementRestAdapter(DocumentStore store, BuildInfo buildInfo) {
    this.store = store;
    this.buildInfo = buildInfo;
  }

  /** The process is up and serving HTTP. */
  public void handleLiveness(Context ctx) {
    ctx.status(200);
    ctx.json(HealthResponse.up());
  }

  /** The process can reach its database; 503 otherwise. */
  public void handleReadiness(Context ctx) {
    if (store.isReady()) {
      ctx.status(200);
      ctx.json(HealthResponse.up());
      return;
    }
    Logger.warn("Readiness probe failed: store is not reachable");
    ctx.status(503);
    ctx.json(HealthResponse.down());
  }

  public void handleVersion(Context ctx) {
    ctx.status(200);
    ctx.json(new VersionResponse(buildInfo.version(), buildInfo.build()));
  }
}
