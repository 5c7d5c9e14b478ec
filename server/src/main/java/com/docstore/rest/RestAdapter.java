package com.docstore.rest;

import com.docstore.common.status.Status;
import io.javalin.http.Context;
import java.util.Map;
import org.tinylog.Logger;

/**
 * Base interface for REST adapters.
 *
 * <p>Provides the shared error response: a JSON object {@code {"error": "..."}} sent with the HTTP
 * status that corresponds to the failed {@link Status}.
 */
public interface RestAdapter {

  /**
   * Sets an error response with the specified status code and message, and logs it.
   *
   * @param ctx The Javalin context to set the error on
   * @param statusCode The HTTP status code to set
   * @param message The error message to include in the response
   */
  default void setError(Context ctx, int statusCode, String message) {
    writeError(ctx, statusCode, message);
    if (statusCode >= 500) {
      Logger.error("Error response: {} - {}", statusCode, message);
    } else {
      Logger.info("Error response: {} - {}", statusCode, message);
    }
  }

  /** Sets an error response derived from a failed status, and logs it. */
  default void setError(Context ctx, Status status) {
    setError(ctx, status.getHttpCode(), String.valueOf(status.getMessage()));
  }

  /**
   * Sets an error response without logging, for callers that have already logged the failure with
   * more context.
   */
  default void writeError(Context ctx, int statusCode, String message) {
    ctx.status(statusCode);
    ctx.json(Map.of("error", message));
  }
}
