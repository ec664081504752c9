package com.mk.fx.qa.stress.execution.resource;

import com.mk.fx.qa.stress.execution.dto.controllerresponse.*;
import com.mk.fx.qa.stress.execution.metrics.SystemMetrics;
import com.mk.fx.qa.stress.execution.metrics.SystemMetricsReader;
import com.mk.fx.qa.stress.execution.model.StressRequest;
import com.mk.fx.qa.stress.execution.service.StressHealthReporter;
import com.mk.fx.qa.stress.execution.service.StressTestService;
import com.mk.fx.qa.stress.execution.service.StressTestService.StopResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

@Slf4j
@Tag(
    name = "Stress Tests",
    description = "Endpoints for starting and stopping stress runs, status, metrics and probes")
@RestController
@Validated
@RequiredArgsConstructor
public class StressController {

  private final StressTestService stressTestService;
  private final SystemMetricsReader metricsReader;
  private final StressHealthReporter healthReporter;
  private final StressMapper stressMapper;
  private final ApiResponseFactory responseFactory;

  // -----------------------------------------------------
  // Stress runs
  // -----------------------------------------------------
  @Operation(
      summary = "Start a stress test",
      description = "Launches the stress tool in the background and returns the run id.")
  @PostMapping("/stress")
  public ResponseEntity<StressSubmissionResponse> startTest(
      @Valid @RequestBody StressSubmissionRequest request) {
    StressRequest stressRequest = stressMapper.toDomain(request);
    log.info(
        "Received stress request cpu={} vm={} duration={} vmBytes={}",
        stressRequest.cpuWorkers(),
        stressRequest.memoryWorkers(),
        stressRequest.duration(),
        stressRequest.memorySize());

    Optional<StressSubmissionOutcome> outcomeOpt = stressTestService.startTest(stressRequest);
    if (outcomeOpt.isEmpty()) {
      return responseFactory.unavailable(
          new StressSubmissionResponse(null, null, "Service not accepting new stress tests"));
    }
    StressSubmissionOutcome outcome = outcomeOpt.get();
    return responseFactory.accepted(
        new StressSubmissionResponse(outcome.runId(), outcome.state(), outcome.message()));
  }

  @Operation(summary = "Stop a stress test", description = "Terminates the given running test.")
  @DeleteMapping("/stress/{runId}")
  public ResponseEntity<?> stopTest(@PathVariable UUID runId) {
    return toResponse(stressTestService.stopTest(runId));
  }

  @Operation(summary = "Stop the running stress test", description = "Terminates any active run.")
  @PostMapping("/stop")
  public ResponseEntity<?> stopCurrent() {
    return toResponse(stressTestService.stopCurrent());
  }

  // -----------------------------------------------------
  // Status
  // -----------------------------------------------------
  @Operation(summary = "Current status", description = "Returns the tracked run or idle.")
  @GetMapping("/status")
  public ResponseEntity<StressStatusResponse> getStatus() {
    return ResponseEntity.ok(
        stressTestService
            .currentStatus()
            .map(stressMapper::toStatusResponse)
            .orElseGet(StressStatusResponse::idle));
  }

  @Operation(summary = "Reset status", description = "Clears a finished run back to idle.")
  @DeleteMapping("/status")
  public ResponseEntity<Void> resetStatus() {
    stressTestService.reset();
    return ResponseEntity.noContent().build();
  }

  @Operation(summary = "Run history", description = "Returns earlier runs, most recent first.")
  @GetMapping("/status/history")
  public ResponseEntity<List<StressStatusResponse>> getHistory() {
    return ResponseEntity.ok(stressMapper.toStatusResponses(stressTestService.getHistory()));
  }

  // -----------------------------------------------------
  // Metrics
  // -----------------------------------------------------
  @Operation(summary = "System metrics", description = "Samples host CPU, memory and load.")
  @GetMapping("/metrics")
  public ResponseEntity<SystemMetrics> getMetrics() {
    return ResponseEntity.ok(metricsReader.read());
  }

  @Operation(summary = "Stress metrics", description = "Returns counters of started runs.")
  @GetMapping("/metrics/stress")
  public ResponseEntity<StressMetricsResponse> getStressMetrics() {
    return ResponseEntity.ok(stressTestService.getMetrics());
  }

  // -----------------------------------------------------
  // Probes
  // -----------------------------------------------------
  @Operation(summary = "Liveness probe", description = "Answers ok while the process serves.")
  @GetMapping({"/health", "/health/live"})
  public ResponseEntity<HealthResponse> health() {
    return ResponseEntity.ok(healthReporter.liveness());
  }

  @Operation(
      summary = "Readiness probe",
      description = "Answers not_ready when the stress binary is unavailable.")
  @GetMapping("/health/ready")
  public ResponseEntity<ReadinessResponse> readiness() {
    ReadinessResponse readiness = healthReporter.readiness();
    log.debug("Readiness check: {}", readiness.status());
    return readiness.isReady()
        ? ResponseEntity.ok(readiness)
        : responseFactory.unavailable(readiness);
  }

  // -----------------------------------------------------
  // Helpers
  // -----------------------------------------------------
  private ResponseEntity<?> toResponse(StopResult result) {
    log.info("Stop requested for {} -> {}", result.getRunId(), result.getState());
    return switch (result.getState()) {
      case NOT_FOUND -> responseFactory.notFound("Stress test not found");
      case NOT_RUNNING -> responseFactory.conflict("No stress test is running");
      case STOP_REQUESTED -> ResponseEntity.ok(
          new StressStopResponse(result.getRunId(), result.getRunState(), "Stop requested"));
    };
  }
}
