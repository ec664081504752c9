package com.mk.fx.qa.stress.execution.model;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class StressRunTest {

  private static final StressRequest REQUEST = new StressRequest(1, 1, 5, "64M");

  @Test
  void running_thenCompleted_recordsExitAndFinishTime() {
    Instant start = Instant.now();
    StressRun run = StressRun.running(UUID.randomUUID(), REQUEST, List.of("stress-ng"), start);
    assertTrue(run.isRunning());

    assertTrue(run.markCompleted(start.plusSeconds(5), 0, "done"));

    StressRunSnapshot snapshot = run.snapshot();
    assertEquals(RunState.COMPLETED, snapshot.state());
    assertEquals(0, snapshot.exitCode());
    assertEquals(start.plusSeconds(5), snapshot.finishedAt());
    assertEquals("done", snapshot.diagnostic());
  }

  @Test
  void terminalStateIsRecordedOnlyOnce() {
    StressRun run =
        StressRun.running(UUID.randomUUID(), REQUEST, List.of("stress-ng"), Instant.now());

    assertTrue(run.markFailed(Instant.now(), 2, "boom"));
    assertFalse(run.markCompleted(Instant.now(), 0, null));
    assertEquals(RunState.FAILED, run.getState());
    assertEquals(2, run.snapshot().exitCode());
  }

  @Test
  void finishedAtNeverPrecedesStartedAt() {
    Instant start = Instant.now();
    StressRun run = StressRun.running(UUID.randomUUID(), REQUEST, List.of("stress-ng"), start);

    run.markFailed(start.minusSeconds(10), 1, "clock stepped back");

    assertEquals(start, run.snapshot().finishedAt());
  }

  @Test
  void spawnFailed_neverRuns() {
    Instant at = Instant.now();
    StressRun run =
        StressRun.spawnFailed(UUID.randomUUID(), REQUEST, List.of("missing"), at, "not found");

    assertFalse(run.isRunning());
    assertEquals(RunState.FAILED, run.getState());
    assertEquals(at, run.snapshot().finishedAt());
    assertNull(run.snapshot().exitCode());
    assertFalse(run.markCompleted(Instant.now(), 0, null));
  }
}
