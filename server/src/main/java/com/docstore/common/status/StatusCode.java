package com.docstore.common.status;

/**
 * Outcome codes for document operations, each bound to the HTTP status returned to callers.
 */
public enum StatusCode {
  OK(200),
  INVALID_ADDRESS(400), // malformed resource path
  INVALID_BODY(400), // missing or unparseable JSON body
  NOT_FOUND(404),
  STORE_ERROR(500), // connection failure, constraint violation, statement timeout
  INTERNAL(500);

  private final int httpCode;

  StatusCode(int httpCode) {
    this.httpCode = httpCode;
  }

  /** Returns the corresponding HTTP status code. */
  public int getHttpCode() {
    return httpCode;
  }

  /** Returns whether this code represents an error. */
  public boolean isError() {
    return this != OK;
  }
}
