package com.docstore.rest;

import static io.javalin.apibuilder.ApiBuilder.delete;
import static io.javalin.apibuilder.ApiBuilder.get;
import static io.javalin.apibuilder.ApiBuilder.path;
import static io.javalin.apibuilder.ApiBuilder.post;
import static io.javalin.apibuilder.ApiBuilder.put;

import com.docstore.AppContext;
import com.docstore.common.status.Status;
import com.docstore.config.BuildInfo;
import com.docstore.config.PutPolicy;
import com.docstore.routing.ResourceRouter;
import io.javalin.Javalin;
import io.javalin.config.RouterConfig;
import org.tinylog.Logger;

/**
 * Creates the REST adapters and binds them to routes.
 *
 * <p>Document routes are registered as a catch-all under {@link ResourceRouter#API_VERSION} so that
 * malformed paths reach {@link ResourceRouter} and are answered with 400 rather than Javalin's 404.
 * Management routes are registered first and therefore take precedence.
 */
public class RestAdapterFactory {

  private final DocumentRestAdapter documentAdapter;
  private final ManagementRestAdapter managementAdapter;

  /**
   * @param context shared store and route table
   * @param putPolicy behaviour of PUT against an identifier with no row
   * @param buildInfo version details for the version endpoint
   */
  public RestAdapterFactory(AppContext context, PutPolicy putPolicy, BuildInfo buildInfo) {
    this.documentAdapter = new DocumentRestAdapter(context, putPolicy);
    this.managementAdapter = new ManagementRestAdapter(context.store(), buildInfo);
  }

  /** Configures the Javalin router to use the REST adapters. */
  public void configureRoutes(RouterConfig router) {
    router.apiBuilder(
        () -> {
          path(
              ResourceRouter.API_VERSION + "/management",
              () -> {
                get("liveness", managementAdapter::handleLiveness);
                get("readiness", managementAdapter::handleReadiness);
                get("version", managementAdapter::handleVersion);
              });

          String documents = ResourceRouter.API_VERSION + "/*";
          get(documents, documentAdapter::handleGet);
          put(documents, documentAdapter::handlePut);
          delete(documents, documentAdapter::handleDelete);
          post(documents, documentAdapter::handlePost);
        });
  }

  /** Maps exceptions that escape a handler to a 500 INTERNAL response. */
  public void configureExceptionHandling(Javalin app) {
    app.exception(
        Exception.class,
        (e, ctx) -> {
          Logger.error(e, "Unhandled exception for {} {}", ctx.method(), ctx.path());
          documentAdapter.setError(ctx, Status.internal("Internal server error", e));
        });
  }

  public DocumentRestAdapter getDocumentAdapter() {
    return documentAdapter;
  }

  public ManagementRestAdapter getManagementAdapter() {
    return managementAdapter;
  }
}
