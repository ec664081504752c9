package com.mk.fx.qa.stress.execution.service;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.stress.execution.cfg.StressProcessingCfg;
import com.mk.fx.qa.stress.execution.dto.controllerresponse.StressMetricsResponse;
import com.mk.fx.qa.stress.execution.dto.controllerresponse.StressSubmissionOutcome;
import com.mk.fx.qa.stress.execution.exception.StressConflictException;
import com.mk.fx.qa.stress.execution.exception.StressSpawnException;
import com.mk.fx.qa.stress.execution.model.RunState;
import com.mk.fx.qa.stress.execution.model.StressRequest;
import com.mk.fx.qa.stress.execution.model.StressRun;
import com.mk.fx.qa.stress.execution.model.StressRunSnapshot;
import com.mk.fx.qa.stress.execution.processors.OutputTail;
import com.mk.fx.qa.stress.execution.processors.StressCommandBuilder;
import com.mk.fx.qa.stress.execution.processors.StressProcessLauncher;
import com.mk.fx.qa.stress.execution.utils.StressUtils;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.BufferedReader;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Owns the single stress-run slot: starts the external tool, supervises it and answers status
 * queries.
 *
 * <p>Responsibilities:
 * - Validates a {@link StressRequest}, launches the tool synchronously so launch failures reach
 *   the caller, then returns without waiting for the run to finish.
 * - Watches every launched process on its own daemon thread, which drains the merged output and
 *   blocks on process exit before recording COMPLETED or FAILED.
 * - Rejects a start while a run is RUNNING; a finished run is replaced by the next start and kept
 *   in a bounded history.
 * - Stops the running process on request or on shutdown.
 *
 * <p>Thread-safety: start, stop and reset are serialized by {@code slotLock}, which also guards
 * the process handle. Status reads go through the volatile slot reference and the run's own
 * synchronized snapshot, so they never wait on a start or a watcher.
 */
@Slf4j
@Service
public class StressTestService {

  private final StressProcessingCfg properties;
  private final StressRequestValidator validator;
  private final StressCommandBuilder commandBuilder;
  private final StressProcessLauncher launcher;
  private final ExecutorService watchers;
  private final ReentrantLock slotLock;
  private final Deque<StressRun> history;
  private final AtomicBoolean acceptingRuns;
  private final AtomicLong totalStarted;
  private final AtomicLong totalCompleted;
  private final AtomicLong totalFailed;

  private volatile StressRun currentRun;
  private volatile Integer lastDurationSeconds;
  private Process currentProcess;

  public StressTestService(
      StressProcessingCfg properties,
      StressRequestValidator validator,
      StressCommandBuilder commandBuilder,
      StressProcessLauncher launcher) {
    this.properties = properties;
    this.validator = validator;
    this.commandBuilder = commandBuilder;
    this.launcher = launcher;
    this.watchers = createWatcherPool();
    this.slotLock = new ReentrantLock();
    this.history = new ConcurrentLinkedDeque<>();
    this.acceptingRuns = new AtomicBoolean(true);
    this.totalStarted = new AtomicLong();
    this.totalCompleted = new AtomicLong();
    this.totalFailed = new AtomicLong();
  }

  @PostConstruct
  void logConfiguration() {
    log.info(
        "StressTestService initialised with binary={} maxDuration={}s maxWorkers={} historySize={}",
        properties.getBinary(),
        properties.getMaxDurationSeconds(),
        properties.getMaxWorkers(),
        properties.getHistorySize());
  }

  private ExecutorService createWatcherPool() {
    ThreadFactory threadFactory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName("stress-watcher-" + thread.getId());
          thread.setDaemon(true);
          return thread;
        };
    return Executors.newCachedThreadPool(threadFactory);
  }

  /**
   * Starts a new stress run.
   *
   * @param request run parameters
   * @return empty if the service is shutting down, otherwise the id of the RUNNING run
   * @throws com.mk.fx.qa.stress.execution.exception.StressValidationException if the request
   *     breaks a limit; nothing is recorded
   * @throws StressConflictException if a run is already RUNNING
   * @throws StressSpawnException if the tool cannot be launched; a FAILED run is recorded
   */
  public Optional<StressSubmissionOutcome> startTest(StressRequest request) {
    if (!acceptingRuns.get()) {
      return Optional.empty();
    }
    validator.validate(request);

    slotLock.lock();
    try {
      StressRun active = currentRun;
      if (active != null && active.isRunning()) {
        log.warn("Stress start rejected, run {} is still running", active.getId());
        throw new StressConflictException(
            active.getId(), "Stress test " + active.getId() + " is already running");
      }

      UUID runId = UUID.randomUUID();
      List<String> command = commandBuilder.build(request);

      Process process;
      try {
        process = launcher.launch(command);
      } catch (IOException ex) {
        String reason = "Failed to launch " + command.get(0) + ": " + ex.getMessage();
        replaceCurrent(StressRun.spawnFailed(runId, request, command, Instant.now(), reason));
        totalFailed.incrementAndGet();
        log.error("Stress run {} could not be started: {}", runId, reason);
        throw new StressSpawnException(runId, reason, ex);
      }

      StressRun run = StressRun.running(runId, request, command, Instant.now());
      replaceCurrent(run);
      currentProcess = process;
      totalStarted.incrementAndGet();
      lastDurationSeconds = request.duration();

      try {
        watchers.execute(() -> watch(run, process));
      } catch (RejectedExecutionException ex) {
        // shutdown raced the start: do not leave an unwatched child behind
        process.destroyForcibly();
        finish(run, process, null, "Service shutting down");
        return Optional.empty();
      }

      log.info(
          "Stress run {} started (cpu={} vm={} vmBytes={} duration={}s, pid={})",
          runId,
          request.cpuWorkers(),
          request.memoryWorkers(),
          request.memorySize(),
          request.duration(),
          process.pid());
      return Optional.of(new StressSubmissionOutcome(runId, RunState.RUNNING, "Stress test started"));
    } finally {
      slotLock.unlock();
    }
  }

  private void replaceCurrent(StressRun next) {
    StressRun previous = currentRun;
    if (previous != null) {
      history.addFirst(previous);
      while (history.size() > properties.getHistorySize()) {
        history.pollLast();
      }
    }
    currentRun = next;
  }

  private void watch(StressRun run, Process process) {
    OutputTail tail = new OutputTail(properties.getOutputTailLines());
    try (BufferedReader reader = process.inputReader()) {
      String line;
      while ((line = reader.readLine()) != null) {
        log.debug("[{}] {}", run.getId(), line);
        tail.add(line);
      }
    } catch (IOException ex) {
      log.warn("Lost output of stress run {}: {}", run.getId(), ex.getMessage());
    }

    try {
      int exitCode = process.waitFor();
      String output = tail.isEmpty() ? null : tail.asText();
      finish(run, process, exitCode, output);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      process.destroyForcibly();
      finish(run, process, null, "Watcher interrupted before the process exited");
    }
  }

  private void finish(StressRun run, Process process, Integer exitCode, String output) {
    Instant now = Instant.now();
    boolean recorded;
    if (exitCode != null && exitCode == 0 && !run.isStopRequested()) {
      recorded = run.markCompleted(now, exitCode, output);
      if (recorded) {
        totalCompleted.incrementAndGet();
        log.info("Stress run {} completed", run.getId());
      }
    } else {
      String reason = failureReason(run, exitCode, output);
      recorded = run.markFailed(now, exitCode, reason);
      if (recorded) {
        totalFailed.incrementAndGet();
        log.warn("Stress run {} failed: {}", run.getId(), firstLine(reason));
      }
    }

    slotLock.lock();
    try {
      if (currentProcess == process) {
        currentProcess = null;
      }
    } finally {
      slotLock.unlock();
    }
  }

  private String failureReason(StressRun run, Integer exitCode, String output) {
    StringBuilder reason = new StringBuilder();
    if (run.isStopRequested()) {
      reason.append("Stopped on request");
      if (exitCode != null) {
        reason.append(" (").append(StressUtils.describeExit(exitCode)).append(')');
      }
    } else if (exitCode != null) {
      reason.append(properties.getBinary()).append(' ').append(StressUtils.describeExit(exitCode));
    } else {
      reason.append("Process did not report an exit code");
    }
    if (output != null) {
      reason.append('\n').append(output);
    }
    return reason.toString();
  }

  private static String firstLine(String text) {
    int newline = text.indexOf('\n');
    return newline < 0 ? text : text.substring(0, newline);
  }

  /** Returns the tracked run, or empty when idle. Never blocks. */
  public Optional<StressRunSnapshot> currentStatus() {
    StressRun run = currentRun;
    return run == null ? Optional.empty() : Optional.of(run.snapshot());
  }

  /** Returns previously tracked runs, most recent first. */
  public List<StressRunSnapshot> getHistory() {
    List<StressRunSnapshot> snapshot = new ArrayList<>();
    for (StressRun run : history) {
      snapshot.add(run.snapshot());
    }
    return snapshot;
  }

  /**
   * Clears a finished run so the status reads idle again.
   *
   * @throws StressConflictException if the tracked run is still RUNNING
   */
  public void reset() {
    slotLock.lock();
    try {
      StressRun run = currentRun;
      if (run == null) {
        return;
      }
      if (run.isRunning()) {
        throw new StressConflictException(
            run.getId(), "Stress test " + run.getId() + " is running and cannot be reset");
      }
      replaceCurrent(null);
      log.info("Stress status reset, run {} moved to history", run.getId());
    } finally {
      slotLock.unlock();
    }
  }

  /** Stops the run with the given id. */
  public StopResult stopTest(UUID runId) {
    return stop(runId);
  }

  /** Stops whatever run is currently RUNNING. */
  public StopResult stopCurrent() {
    return stop(null);
  }

  private StopResult stop(UUID runId) {
    StressRun run;
    Process process;
    slotLock.lock();
    try {
      run = currentRun;
      if (run == null || (runId != null && !run.getId().equals(runId))) {
        if (runId == null) {
          return StopResult.notRunning(null, RunState.IDLE);
        }
        return findInHistory(runId)
            .map(previous -> StopResult.notRunning(runId, previous.getState()))
            .orElseGet(StopResult::notFound);
      }
      if (!run.isRunning()) {
        return StopResult.notRunning(run.getId(), run.getState());
      }
      run.requestStop();
      process = currentProcess;
    } finally {
      slotLock.unlock();
    }

    log.info("Stopping stress run {}", run.getId());
    if (process != null) {
      terminate(process);
    }
    return StopResult.stopRequested(run.getId(), run.getState());
  }

  private Optional<StressRun> findInHistory(UUID runId) {
    return history.stream().filter(run -> run.getId().equals(runId)).findFirst();
  }

  private void terminate(Process process) {
    process.descendants().forEach(ProcessHandle::destroy);
    process.destroy();
    try {
      if (!process.waitFor(properties.getStopTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Stress process {} ignored SIGTERM, killing it", process.pid());
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      process.destroyForcibly();
    }
  }

  /** Returns counters of this service instance. */
  public StressMetricsResponse getMetrics() {
    StressRun run = currentRun;
    return new StressMetricsResponse(
        totalStarted.get(),
        totalCompleted.get(),
        totalFailed.get(),
        run != null && run.isRunning(),
        lastDurationSeconds);
  }

  public boolean isAcceptingRuns() {
    return acceptingRuns.get();
  }

  /** Stops accepting runs, terminates a running child and releases the watcher threads. */
  public void shutdown() {
    if (!acceptingRuns.compareAndSet(true, false)) {
      return;
    }
    StressRun run = currentRun;
    if (run != null && run.isRunning()) {
      stopTest(run.getId());
    }
    watchers.shutdown();
  }

  @PreDestroy
  void onShutdown() {
    shutdown();
  }

  @VisibleForTesting
  boolean awaitWatchers(long timeout, TimeUnit unit) throws InterruptedException {
    return watchers.awaitTermination(timeout, unit);
  }

  /** Outcome of a stop request. */
  @Getter
  public static class StopResult {
    public enum StopState {
      STOP_REQUESTED,
      NOT_RUNNING,
      NOT_FOUND
    }

    private final StopState state;
    private final UUID runId;
    private final RunState runState;

    private StopResult(StopState state, UUID runId, RunState runState) {
      this.state = state;
      this.runId = runId;
      this.runState = runState;
    }

    /** SIGTERM was sent; the watcher records the exit. */
    public static StopResult stopRequested(UUID runId, RunState runState) {
      return new StopResult(StopState.STOP_REQUESTED, runId, runState);
    }

    /** The run exists but is not RUNNING (or nothing runs at all). */
    public static StopResult notRunning(UUID runId, RunState runState) {
      return new StopResult(StopState.NOT_RUNNING, runId, runState);
    }

    public static StopResult notFound() {
      return new StopResult(StopState.NOT_FOUND, null, null);
    }
  }
}
