package com.docstore.rest.dto;

/** Body of the liveness and readiness probes. */
public record HealthResponse(String status) {

  public static HealthResponse up() {
    return new HealthResponse("UP");
  }

  public static HealthResponse down() {
    return new HealthResponse("DOWN");
  }
}
