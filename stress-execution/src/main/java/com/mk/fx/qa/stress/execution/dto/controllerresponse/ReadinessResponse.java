package com.mk.fx.qa.stress.execution.dto.controllerresponse;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Readiness answer: {@code "ready"}, or {@code "not_ready"} with the failed precondition.
 */
public record ReadinessResponse(String status, String reason) {

  public static ReadinessResponse ready() {
    return new ReadinessResponse("ready", null);
  }

  public static ReadinessResponse notReady(String reason) {
    return new ReadinessResponse("not_ready", reason);
  }

  @JsonIgnore
  public boolean isReady() {
    return "ready".equals(status);
  }
}
