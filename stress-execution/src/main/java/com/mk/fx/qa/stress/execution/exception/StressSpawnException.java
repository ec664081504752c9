package com.mk.fx.qa.stress.execution.exception;

import java.util.UUID;

/** The stress tool could not be launched; the failed run is still recorded. */
public class StressSpawnException extends RuntimeException {

  private final UUID runId;

  public StressSpawnException(UUID runId, String message, Throwable cause) {
    super(message, cause);
    this.runId = runId;
  }

  public UUID getRunId() {
    return runId;
  }
}
