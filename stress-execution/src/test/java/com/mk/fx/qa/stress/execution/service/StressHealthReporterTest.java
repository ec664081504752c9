package com.mk.fx.qa.stress.execution.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.mk.fx.qa.stress.execution.cfg.StressProcessingCfg;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

@DisabledOnOs(OS.WINDOWS)
class StressHealthReporterTest {

  @TempDir Path tempDir;

  private Path executable(String name) throws IOException {
    Path file = Files.writeString(tempDir.resolve(name), "#!/bin/sh\nexit 0\n");
    assertThat(file.toFile().setExecutable(true)).isTrue();
    return file;
  }

  private static StressHealthReporter reporterFor(String binary) {
    StressProcessingCfg cfg = new StressProcessingCfg();
    cfg.setBinary(binary);
    StressHealthReporter reporter = new StressHealthReporter(cfg, "1.2.3");
    reporter.checkPreconditions();
    return reporter;
  }

  @Test
  void liveness_isAlwaysOk() {
    var reporter = reporterFor(tempDir.resolve("missing").toString());

    var health = reporter.liveness();

    assertThat(health.status()).isEqualTo("ok");
    assertThat(health.version()).isEqualTo("1.2.3");
    assertThat(health.timestamp()).isNotNull();
    assertThat(health.host()).isNotBlank();
  }

  @Test
  void readiness_readyWhenBinaryIsExecutable() throws IOException {
    Path binary = executable("stress-ng");

    var readiness = reporterFor(binary.toString()).readiness();

    assertThat(readiness.isReady()).isTrue();
    assertThat(readiness.status()).isEqualTo("ready");
    assertThat(readiness.reason()).isNull();
  }

  @Test
  void readiness_notReadyWhenBinaryMissing() {
    var readiness = reporterFor(tempDir.resolve("stress-ng").toString()).readiness();

    assertThat(readiness.isReady()).isFalse();
    assertThat(readiness.status()).isEqualTo("not_ready");
    assertThat(readiness.reason()).contains("not found");
  }

  @Test
  void readiness_notReadyWhenFileIsNotExecutable() throws IOException {
    Path plain = Files.writeString(tempDir.resolve("stress-ng"), "not a program");
    assertThat(plain.toFile().setExecutable(false)).isTrue();

    assertThat(reporterFor(plain.toString()).readiness().isReady()).isFalse();
  }

  @Test
  void resolveExecutable_searchesPathForBareNames() throws IOException {
    Path binary = executable("my-stress");
    String searchPath = "/nonexistent-dir:" + tempDir;

    assertThat(StressHealthReporter.resolveExecutable("my-stress", searchPath)).contains(binary);
    assertThat(StressHealthReporter.resolveExecutable("other-stress", searchPath)).isEmpty();
    assertThat(StressHealthReporter.resolveExecutable("my-stress", null)).isEmpty();
    assertThat(StressHealthReporter.resolveExecutable(" ", searchPath)).isEmpty();
  }
}
