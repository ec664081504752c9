package com.mk.fx.qa.stress.execution.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Mutable record of a single stress run.
 *
 * <p>Created by the service when a run starts and completed exactly once by the watcher that
 * observes the child process exit. All state transitions and reads are synchronized on the
 * instance so request threads always see a consistent snapshot.
 */
public class StressRun {

  private final UUID id;
  private final StressRequest request;
  private final List<String> command;
  private final Instant startedAt;

  private RunState state;
  private Instant finishedAt;
  private Integer exitCode;
  private String diagnostic;
  private boolean stopRequested;

  private StressRun(UUID id, StressRequest request, List<String> command, Instant startedAt) {
    this.id = id;
    this.request = request;
    this.command = List.copyOf(command);
    this.startedAt = startedAt;
  }

  /** A run whose process was launched and is now being watched. */
  public static StressRun running(
      UUID id, StressRequest request, List<String> command, Instant startedAt) {
    StressRun run = new StressRun(id, request, command, startedAt);
    run.state = RunState.RUNNING;
    return run;
  }

  /** A run whose process could not be launched; it never passes through RUNNING. */
  public static StressRun spawnFailed(
      UUID id, StressRequest request, List<String> command, Instant at, String diagnostic) {
    StressRun run = new StressRun(id, request, command, at);
    run.state = RunState.FAILED;
    run.finishedAt = at;
    run.diagnostic = diagnostic;
    return run;
  }

  public UUID getId() {
    return id;
  }

  public StressRequest getRequest() {
    return request;
  }

  public Instant getStartedAt() {
    return startedAt;
  }

  public synchronized RunState getState() {
    return state;
  }

  public synchronized boolean isRunning() {
    return state == RunState.RUNNING;
  }

  public synchronized boolean isStopRequested() {
    return stopRequested;
  }

  /** Flags the run as stopped by a caller so the exit is reported as such. */
  public synchronized void requestStop() {
    stopRequested = true;
  }

  /**
   * Moves the run to COMPLETED.
   *
   * @return {@code false} if the run had already reached a terminal state
   */
  public synchronized boolean markCompleted(Instant at, int code, String output) {
    if (state != RunState.RUNNING) {
      return false;
    }
    state = RunState.COMPLETED;
    finishedAt = notBefore(at);
    exitCode = code;
    diagnostic = output;
    return true;
  }

  /**
   * Moves the run to FAILED.
   *
   * @param code exit code, or {@code null} when the process never reported one
   * @return {@code false} if the run had already reached a terminal state
   */
  public synchronized boolean markFailed(Instant at, Integer code, String reason) {
    if (state != RunState.RUNNING) {
      return false;
    }
    state = RunState.FAILED;
    finishedAt = notBefore(at);
    exitCode = code;
    diagnostic = reason;
    return true;
  }

  public synchronized StressRunSnapshot snapshot() {
    return new StressRunSnapshot(
        id, request, command, state, startedAt, finishedAt, exitCode, diagnostic);
  }

  // finished_at >= started_at even if the wall clock steps back
  private Instant notBefore(Instant at) {
    return at.isBefore(startedAt) ? startedAt : at;
  }
}
