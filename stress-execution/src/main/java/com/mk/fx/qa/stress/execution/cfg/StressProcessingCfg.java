package com.mk.fx.qa.stress.execution.cfg;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Settings for launching and supervising the external stress tool, bound from {@code stress.*}.
 *
 * <pre>{@code
 * stress:
 *   binary: /usr/bin/stress-ng
 *   extra-args: [--metrics-brief, --verbose]
 *   max-duration-seconds: 3600
 *   max-workers: 64
 *   history-size: 20
 *   output-tail-lines: 50
 *   stop-timeout: 5s
 * }</pre>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "stress")
public class StressProcessingCfg {

  /** Executable name (looked up on the PATH) or absolute path of the stress tool. */
  @NotBlank private String binary = "stress-ng";

  /** Arguments appended after the derived worker and timeout arguments. */
  @NotNull
  private List<String> extraArgs = new ArrayList<>(List.of("--metrics-brief", "--verbose"));

  /** Upper bound for the requested duration. */
  @Positive private int maxDurationSeconds = 3600;

  @Min(1)
  @Max(1024)
  private int maxWorkers = 64;

  /** Number of finished runs kept for the history endpoint. */
  @Positive private int historySize = 20;

  /** Number of trailing output lines kept as the diagnostic of a run. */
  @Positive private int outputTailLines = 50;

  /** Grace period between SIGTERM and a forced kill when a run is stopped. */
  @NotNull private Duration stopTimeout = Duration.ofSeconds(5);
}
