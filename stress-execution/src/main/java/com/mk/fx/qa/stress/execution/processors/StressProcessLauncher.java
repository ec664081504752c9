package com.mk.fx.qa.stress.execution.processors;

import java.io.IOException;
import java.util.List;

/** Starts the external stress tool. */
public interface StressProcessLauncher {

  /**
   * Launches {@code command} as a child process with stdout and stderr merged.
   *
   * @throws IOException if the executable is missing or cannot be run
   */
  Process launch(List<String> command) throws IOException;
}
