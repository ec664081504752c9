package com.mk.fx.qa.stress.execution.exception;

import java.util.UUID;

/** A stress run is active and the requested operation needs the slot to be free. */
public class StressConflictException extends RuntimeException {

  private final UUID activeRunId;

  public StressConflictException(UUID activeRunId, String message) {
    super(message);
    this.activeRunId = activeRunId;
  }

  public UUID getActiveRunId() {
    return activeRunId;
  }
}
