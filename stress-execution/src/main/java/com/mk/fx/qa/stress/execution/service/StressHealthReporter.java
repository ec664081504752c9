package com.mk.fx.qa.stress.execution.service;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.stress.execution.cfg.StressProcessingCfg;
import com.mk.fx.qa.stress.execution.dto.controllerresponse.HealthResponse;
import com.mk.fx.qa.stress.execution.dto.controllerresponse.ReadinessResponse;
import com.mk.fx.qa.stress.execution.metrics.EnvironmentInfo;
import jakarta.annotation.PostConstruct;
import java.io.File;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Liveness and readiness answers for the orchestrator.
 *
 * <p>Liveness is unconditional. Readiness only reflects whether the stress binary was found at
 * startup; an active stress run does not make the service unready.
 */
@Slf4j
@Component
public class StressHealthReporter {

  private final StressProcessingCfg properties;
  private final String version;
  private volatile String notReadyReason;

  public StressHealthReporter(
      StressProcessingCfg properties, @Value("${app.version:1.0.0}") String version) {
    this.properties = properties;
    this.version = version;
  }

  @PostConstruct
  void checkPreconditions() {
    String binary = properties.getBinary();
    Optional<Path> resolved = resolveExecutable(binary, System.getenv("PATH"));
    if (resolved.isPresent()) {
      notReadyReason = null;
      log.info("Stress binary resolved to {}", resolved.get());
    } else {
      notReadyReason = "Stress binary '" + binary + "' not found or not executable";
      log.error("{}; stress tests cannot be started", notReadyReason);
    }
  }

  public HealthResponse liveness() {
    return new HealthResponse("ok", Instant.now(), version, EnvironmentInfo.host());
  }

  public ReadinessResponse readiness() {
    String reason = notReadyReason;
    return reason == null ? ReadinessResponse.ready() : ReadinessResponse.notReady(reason);
  }

  /**
   * Resolves {@code binary} the way a shell would: paths containing a separator are taken as is,
   * bare names are searched in {@code searchPath}.
   */
  @VisibleForTesting
  static Optional<Path> resolveExecutable(String binary, String searchPath) {
    if (binary == null || binary.isBlank()) {
      return Optional.empty();
    }
    try {
      if (binary.contains(File.separator)) {
        Path path = Path.of(binary);
        return isExecutableFile(path) ? Optional.of(path) : Optional.empty();
      }
      if (searchPath == null || searchPath.isBlank()) {
        return Optional.empty();
      }
      for (String dir : searchPath.split(File.pathSeparator)) {
        if (dir.isBlank()) {
          continue;
        }
        Path candidate = Path.of(dir, binary);
        if (isExecutableFile(candidate)) {
          return Optional.of(candidate);
        }
      }
    } catch (InvalidPathException ex) {
      log.warn("Invalid stress binary path {}: {}", binary, ex.getMessage());
    }
    return Optional.empty();
  }

  private static boolean isExecutableFile(Path path) {
    return Files.isRegularFile(path) && Files.isExecutable(path);
  }
}
