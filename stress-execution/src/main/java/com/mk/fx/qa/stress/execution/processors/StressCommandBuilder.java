package com.mk.fx.qa.stress.execution.processors;

import static com.mk.fx.qa.stress.execution.utils.StressUtils.formatByteSize;
import static com.mk.fx.qa.stress.execution.utils.StressUtils.parseByteSize;

import com.mk.fx.qa.stress.execution.cfg.StressProcessingCfg;
import com.mk.fx.qa.stress.execution.model.StressRequest;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Derives the stress-ng command line from a validated request.
 *
 * <p>Worker blocks are emitted only for non-zero counts: stress-ng reads {@code --cpu 0} as "one
 * stressor per online CPU", which is not what a request for zero CPU workers means.
 */
@Component
public class StressCommandBuilder {

  private final StressProcessingCfg properties;

  public StressCommandBuilder(StressProcessingCfg properties) {
    this.properties = properties;
  }

  public List<String> build(StressRequest request) {
    List<String> command = new ArrayList<>();
    command.add(properties.getBinary());
    if (request.cpuWorkers() > 0) {
      command.add("--cpu");
      command.add(Integer.toString(request.cpuWorkers()));
    }
    if (request.memoryWorkers() > 0) {
      command.add("--vm");
      command.add(Integer.toString(request.memoryWorkers()));
      command.add("--vm-bytes");
      command.add(formatByteSize(parseByteSize(request.memorySize())));
    }
    command.add("--timeout");
    command.add(request.duration() + "s");
    command.addAll(properties.getExtraArgs());
    return List.copyOf(command);
  }
}
