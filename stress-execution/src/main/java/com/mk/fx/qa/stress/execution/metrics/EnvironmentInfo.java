package com.mk.fx.qa.stress.execution.metrics;

import java.net.InetAddress;
import java.net.UnknownHostException;

/** Host identification reported by the liveness probe. */
public final class EnvironmentInfo {

  private EnvironmentInfo() {
    // Prevent instantiation
  }

  /**
   * Returns the pod or machine name: {@code HOSTNAME} when set (as in Kubernetes pods), otherwise
   * the resolved local host name, or {@code "unknown"}.
   */
  public static String host() {
    String env = System.getenv("HOSTNAME");
    if (env != null && !env.isBlank()) {
      return env;
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException e) {
      return "unknown";
    }
  }
}
