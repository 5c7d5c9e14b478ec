package com.docstore.rest;

import com.docstore.AppContext;
import com.docstore.common.status.Status;
import com.docstore.common.status.StatusOr;
import com.docstore.config.PutPolicy;
import com.docstore.rest.dto.IdentifierResponse;
import com.docstore.routing.ConcreteKey;
import com.docstore.routing.ResourceAddress;
import com.docstore.util.JsonBodies;
import io.javalin.http.Context;
import java.util.UUID;
import org.tinylog.Logger;

/**
 * REST adapter for document CRUD.
 *
 * <p>Every handler resolves the request path first and rejects malformed addresses and bodies
 * before touching the store. At most one store call is made per request:
 *
 * <ul>
 *   <li>GET on the LIST key allocates an identifier; GET on an identifier returns the document
 *   <li>PUT replaces the body of an identifier; with {@link PutPolicy#REJECT_UNKNOWN} an identifier
 *       without a row answers 404, with {@link PutPolicy#CREATE_UNKNOWN} the row is created
 *   <li>DELETE removes a document
 *   <li>POST on the LIST key stores a new document under a fresh identifier
 * </ul>
 */
public class DocumentRestAdapter implements RestAdapter {

  private final AppContext context;
  private final PutPolicy putPolicy;

  /**
   * @param context shared store and route table
   * @param putPolicy behaviour of PUT against an identifier with no row
   */
  public DocumentRestAdapter(AppContext context, PutPolicy putPolicy) {
    this.context = context;
    this.putPolicy = putPolicy;
  }

  /**
   * Handles GET: allocation on the LIST key, read on a concrete identifier.
   *
   * @param ctx The Javalin context containing the request and response
   */
  public void handleGet(Context ctx) {
    StatusOr<ResourceAddress> addressOr = context.router().resolve(ctx.path());
    if (addressOr.isNotOk()) {
      setError(ctx, addressOr.getStatus());
      return;
    }
    ResourceAddress address = addressOr.getValue();

    if (address.key() instanceof ConcreteKey concrete) {
      Logger.info("REST GetDocument request for {}", address);
      StatusOr<String> bodyOr = context.store().get(address.type(), concrete.identifier());
      if (bodyOr.isNotOk()) {
        fail(ctx, "get", address, bodyOr.getStatus());
        return;
      }
      ctx.status(200);
      ctx.contentType("application/json");
      ctx.result(bodyOr.getValue());
      return;
    }

    Logger.info("REST AllocateIdentifier request for {}", address);
    StatusOr<UUID> idOr = context.store().allocate(address.type());
    if (idOr.isNotOk()) {
      fail(ctx, "allocate", address, idOr.getStatus());
      return;
    }
    Logger.info("Allocated {} in namespace {}", idOr.getValue(), address.namespace());
    ctx.status(200);
    ctx.json(new IdentifierResponse(idOr.getValue().toString()));
  }

  /**
   * Handles PUT: replaces the body stored under a concrete identifier.
   *
   * @param ctx The Javalin context containing the request and response
   */
  public void handlePut(Context ctx) {
    StatusOr<ConcreteTarget> targetOr = resolveConcrete(ctx, "PUT");
    if (targetOr.isNotOk()) {
      setError(ctx, targetOr.getStatus());
      return;
    }
    ConcreteTarget target = targetOr.getValue();

    String body = ctx.body();
    Status bodyStatus = JsonBodies.validate(body);
    if (bodyStatus.isError()) {
      setError(ctx, bodyStatus);
      return;
    }

    Logger.info("REST PutDocument request for {} with policy {}", target.address(), putPolicy);
    Status status =
        switch (putPolicy) {
          case REJECT_UNKNOWN -> context.store().replace(
              target.address().type(), target.identifier(), body);
          case CREATE_UNKNOWN -> context.store().upsert(
              target.address().type(), target.identifier(), body);
        };
    if (status.isError()) {
      fail(ctx, "put", target.address(), status);
      return;
    }
    ctx.status(200);
    ctx.json(new IdentifierResponse(target.identifier().toString()));
  }

  /**
   * Handles DELETE: removes the document stored under a concrete identifier.
   *
   * @param ctx The Javalin context containing the request and response
   */
  public void handleDelete(Context ctx) {
    StatusOr<ConcreteTarget> targetOr = resolveConcrete(ctx, "DELETE");
    if (targetOr.isNotOk()) {
      setError(ctx, targetOr.getStatus());
      return;
    }
    ConcreteTarget target = targetOr.getValue();

    Logger.info("REST DeleteDocument request for {}", target.address());
    Status status = context.store().delete(target.address().type(), target.identifier());
    if (status.isError()) {
      fail(ctx, "delete", target.address(), status);
      return;
    }
    ctx.status(204);
  }

  /**
   * Handles POST on the LIST key: stores a new document and answers 201 with its identifier and
   * location.
   *
   * @param ctx The Javalin context containing the request and response
   */
  public void handlePost(Context ctx) {
    StatusOr<ResourceAddress> addressOr = context.router().resolve(ctx.path());
    if (addressOr.isNotOk()) {
      setError(ctx, addressOr.getStatus());
      return;
    }
    ResourceAddress address = addressOr.getValue();
    if (!address.key().isAllocate()) {
      setError(
          ctx, Status.invalidAddress("POST creates documents on the LIST key, not on " + address));
      return;
    }

    String body = ctx.body();
    Status bodyStatus = JsonBodies.validate(body);
    if (bodyStatus.isError()) {
      setError(ctx, bodyStatus);
      return;
    }

    Logger.info("REST CreateDocument request for {}", address);
    StatusOr<UUID> idOr = context.store().create(address.type(), body);
    if (idOr.isNotOk()) {
      fail(ctx, "create", address, idOr.getStatus());
      return;
    }
    ResourceAddress created = address.withKey(new ConcreteKey(idOr.getValue()));
    ctx.status(201);
    ctx.header("Location", context.router().pathFor(created));
    ctx.json(new IdentifierResponse(idOr.getValue().toString()));
  }

  private StatusOr<ConcreteTarget> resolveConcrete(Context ctx, String method) {
    return context
        .router()
        .resolve(ctx.path())
        .flatMap(
            address -> {
              if (address.key() instanceof ConcreteKey concrete) {
                return StatusOr.ofValue(new ConcreteTarget(address, concrete.identifier()));
              }
              return StatusOr.ofStatus(
                  Status.invalidAddress(method + " requires a document identifier, not LIST"));
            });
  }

  /** Logs a failed store call with enough context to trace it, then sends the error. */
  private void fail(Context ctx, String operation, ResourceAddress address, Status status) {
    if (status.getHttpCode() < 500) {
      Logger.info("{} {}: {}", operation, address, status.getMessage());
    } else if (status.getCause() != null) {
      Logger.error(
          status.getCause(), "{} failed for {}: {}", operation, address, status.getMessage());
    } else {
      Logger.error("{} failed for {}: {}", operation, address, status.getMessage());
    }
    writeError(ctx, status.getHttpCode(), String.valueOf(status.getMessage()));
  }

  private record ConcreteTarget(ResourceAddress address, UUID identifier) {}
}
