package com.mk.fx.qa.stress.execution.dto.controllerresponse;

import com.mk.fx.qa.stress.execution.model.RunState;
import com.mk.fx.qa.stress.execution.model.StressRequest;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * State of the tracked run as reported by {@code GET /status}. When nothing has run yet only
 * {@code state = idle} is present.
 */
public record StressStatusResponse(
    RunState state,
    UUID runId,
    StressRequest request,
    Instant startedAt,
    Instant finishedAt,
    Integer exitCode,
    String diagnostic,
    List<String> command) {

  public static StressStatusResponse idle() {
    return new StressStatusResponse(RunState.IDLE, null, null, null, null, null, null, null);
  }
}
