package com.docstore.common.status;

import java.util.Objects;
import javax.annotation.Nonnull;

/**
 * The outcome of an operation that produces no value: either OK or an error code with a message
 * and, for store failures, the underlying cause.
 */
public class Status {
  private static final Status OK = new Status(StatusCode.OK, null, null);

  private final StatusCode code;
  private final String message;
  private final Throwable cause;

  private Status(StatusCode code, String message, Throwable cause) {
    this.code = Objects.requireNonNull(code);
    this.message = message;
    this.cause = cause;
  }

  /** Creates a new status with the given code and message. */
  public static Status of(StatusCode code, String message) {
    return new Status(code, message, null);
  }

  /** Returns the OK status. */
  public static Status ok() {
    return OK;
  }

  /** A request path that does not name a resource this service knows about. */
  public static Status invalidAddress(String message) {
    return new Status(StatusCode.INVALID_ADDRESS, message, null);
  }

  /** A request body that is missing or is not JSON. */
  public static Status invalidBody(String message) {
    return new Status(StatusCode.INVALID_BODY, message, null);
  }

  public static Status notFound(String message) {
    return new Status(StatusCode.NOT_FOUND, message, null);
  }

  /** A failure reported by the database or the connection pool. */
  public static Status storeError(String message, Throwable cause) {
    return new Status(StatusCode.STORE_ERROR, message, cause);
  }

  public static Status internal(String message, Throwable cause) {
    return new Status(StatusCode.INTERNAL, message, cause);
  }

  @Nonnull
  public StatusCode getCode() {
    return code;
  }

  /** Returns the HTTP status code corresponding to this status. */
  public int getHttpCode() {
    return code.getHttpCode();
  }

  /** Returns the message for this status, or null if there is no message. */
  public String getMessage() {
    return message;
  }

  /** Returns the cause of this status, or null if there is no cause. */
  public Throwable getCause() {
    return cause;
  }

  public boolean isError() {
    return code.isError();
  }

  public boolean isOk() {
    return !code.isError();
  }

  @Override
  public String toString() {
    if (message == null) {
      return code.toString();
    }
    return code + ": " + message;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    Status other = (Status) obj;
    return code == other.code
        && Objects.equals(message, other.message)
        && Objects.equals(cause, other.cause);
  }

  @Override
  public int hashCode() {
    return Objects.hash(code, message, cause);
  }
}
