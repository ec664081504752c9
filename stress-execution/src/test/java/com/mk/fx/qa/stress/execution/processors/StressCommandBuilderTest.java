package com.mk.fx.qa.stress.execution.processors;

import static org.assertj.core.api.Assertions.assertThat;

import com.mk.fx.qa.stress.execution.cfg.StressProcessingCfg;
import com.mk.fx.qa.stress.execution.model.StressRequest;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class StressCommandBuilderTest {

  private StressProcessingCfg cfg;
  private StressCommandBuilder builder;

  @BeforeEach
  void setUp() {
    cfg = new StressProcessingCfg();
    cfg.setBinary("/usr/bin/stress-ng");
    builder = new StressCommandBuilder(cfg);
  }

  @Test
  void build_includesCpuMemoryAndTimeoutArguments() {
    List<String> command = builder.build(new StressRequest(4, 2, 60, "512M"));

    assertThat(command)
        .containsExactly(
            "/usr/bin/stress-ng",
            "--cpu",
            "4",
            "--vm",
            "2",
            "--vm-bytes",
            "512M",
            "--timeout",
            "60s",
            "--metrics-brief",
            "--verbose");
  }

  @Test
  void build_omitsCpuBlockForZeroCpuWorkers() {
    List<String> command = builder.build(new StressRequest(0, 1, 30, "1g"));

    assertThat(command).doesNotContain("--cpu");
    assertThat(command).containsSubsequence("--vm", "1", "--vm-bytes", "1G");
  }

  @Test
  void build_omitsMemoryBlockForZeroMemoryWorkers() {
    List<String> command = builder.build(new StressRequest(2, 0, 30, "256M"));

    assertThat(command).doesNotContain("--vm", "--vm-bytes");
    assertThat(command).containsSubsequence("--cpu", "2", "--timeout", "30s");
  }

  @Test
  void build_isDeterministicAndAppendsConfiguredExtraArgs() {
    cfg.setExtraArgs(List.of("--metrics", "--times"));
    StressRequest request = new StressRequest(1, 1, 10, "128M");

    List<String> first = builder.build(request);
    List<String> second = builder.build(request);

    assertThat(first).isEqualTo(second);
    assertThat(first).endsWith("--timeout", "10s", "--metrics", "--times");
  }
}
