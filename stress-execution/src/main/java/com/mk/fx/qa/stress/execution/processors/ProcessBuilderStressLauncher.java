package com.mk.fx.qa.stress.execution.processors;

import java.io.IOException;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class ProcessBuilderStressLauncher implements StressProcessLauncher {

  @Override
  public Process launch(List<String> command) throws IOException {
    log.info("Launching: {}", String.join(" ", command));
    Process process = new ProcessBuilder(command).redirectErrorStream(true).start();
    // the tool never reads stdin
    process.getOutputStream().close();
    return process;
  }
}
